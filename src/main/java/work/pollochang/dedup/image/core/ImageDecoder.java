package work.pollochang.dedup.image.core;

import java.nio.file.Path;

/**
 * 解碼器介面：輸入檔案路徑，輸出正規化的灰階像素格。
 * <p>
 * 核心流程只依賴此介面，不接觸任何特定影像函式庫的型別。
 * 逾時策略由實作自行決定。
 */
@FunctionalInterface
public interface ImageDecoder {

    /**
     * @param path 圖片檔案
     * @return 正規化後的像素格
     * @throws DecodeException 檔案無法讀取或不是可解碼的圖片
     */
    PixelGrid decode(Path path) throws DecodeException;
}
