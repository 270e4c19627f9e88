package work.pollochang.dedup.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.tools.ImageTools;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 以 javax.imageio 實作的解碼器。
 * <p>
 * 讀取第一個影格，過大的圖片先以二次取樣降低記憶體用量，
 * 再轉為灰階並以面積平均縮成 {@link PixelGrid#NORMALIZED_SIZE} 見方的像素格。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ImageIoDecoder implements ImageDecoder {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    /** 初步讀取時最長邊的目標像素數 */
    private static final int PREFERRED_MAX_DIM = 1024;

    private final int gridSize;

    public ImageIoDecoder() {
        this(PixelGrid.NORMALIZED_SIZE);
    }

    public ImageIoDecoder(int gridSize) {
        if (gridSize <= 0) {
            throw new IllegalArgumentException("gridSize 必須為正數: " + gridSize);
        }
        this.gridSize = gridSize;
    }

    @Override
    public PixelGrid decode(Path path) throws DecodeException {
        if (!Files.isReadable(path)) {
            throw new DecodeException("檔案不存在或不可讀");
        }

        try (InputStream raw = Files.newInputStream(path);
             ImageInputStream in = ImageIO.createImageInputStream(raw)) {
            if (in == null) {
                throw new DecodeException("無法建立圖片輸入流");
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new DecodeException("找不到對應的圖片讀取器");
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new DecodeException("圖片尺寸無效: " + width + "x" + height);
                }

                ImageReadParam param = reader.getDefaultReadParam();
                int maxDim = Math.max(width, height);
                if (maxDim > PREFERRED_MAX_DIM) {
                    // 取樣率取 2 的冪，對某些 JPG 解碼器更友好
                    int subsampling = Integer.highestOneBit(maxDim / PREFERRED_MAX_DIM);
                    if (subsampling > 1) {
                        log.debug("{} - 對圖片應用二次取樣，比率: {}", path.getFileName(), subsampling);
                        param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                    }
                }

                BufferedImage image = reader.read(0, param);
                try {
                    return ImageTools.toGrayscaleGrid(image, gridSize);
                } finally {
                    image.flush();
                }
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new DecodeException("讀取圖片時發生 I/O 錯誤 (可能非支援格式或檔案損毀): " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // 部分 ImageReader 對損毀的檔案會丟出非受檢例外
            throw new DecodeException("解碼器無法處理此檔案: " + e, e);
        }
    }
}
