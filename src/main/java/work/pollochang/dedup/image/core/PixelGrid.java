package work.pollochang.dedup.image.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * 正規化後的灰階像素格，數值範圍 0~255，以列為主 (row-major) 排列。
 * <p>
 * 本類別為不可變物件；建構時會複製傳入的陣列。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class PixelGrid {

    /** 解碼器輸出的標準尺寸 */
    public static final int NORMALIZED_SIZE = 32;

    private final int width;
    private final int height;
    private final double[] values;

    private PixelGrid(int width, int height, double[] values, boolean copy) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("像素格尺寸必須為正數: " + width + "x" + height);
        }
        Objects.requireNonNull(values, "values must not be null");
        if (values.length != width * height) {
            throw new IllegalArgumentException("像素數量 " + values.length + " 與尺寸 " + width + "x" + height + " 不符");
        }
        this.width = width;
        this.height = height;
        this.values = copy ? values.clone() : values;
    }

    /**
     * 以列為主的數值陣列建立像素格。
     *
     * @param width  寬
     * @param height 高
     * @param values 長度必須為 {@code width * height}
     * @return 新的像素格
     */
    public static PixelGrid of(int width, int height, double[] values) {
        return new PixelGrid(width, height, values, true);
    }

    /**
     * 建立單一亮度的像素格，主要用於測試。
     */
    public static PixelGrid filled(int width, int height, double value) {
        double[] values = new double[width * height];
        Arrays.fill(values, value);
        return new PixelGrid(width, height, values, false);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public double get(int x, int y) {
        return values[y * width + x];
    }

    /**
     * 以面積加權平均 (box filter) 重新取樣至指定尺寸。
     * <p>
     * 每個目標格的值為其覆蓋到的來源區域之加權平均，縮小時可以壓低高頻雜訊；
     * 計算順序固定，相同輸入必定得到相同結果。
     *
     * @param targetWidth  目標寬
     * @param targetHeight 目標高
     * @return 重新取樣後的像素格；尺寸相同時回傳自身
     */
    public PixelGrid resample(int targetWidth, int targetHeight) {
        if (targetWidth <= 0 || targetHeight <= 0) {
            throw new IllegalArgumentException("目標尺寸必須為正數: " + targetWidth + "x" + targetHeight);
        }
        if (targetWidth == width && targetHeight == height) {
            return this;
        }

        double scaleX = (double) width / targetWidth;
        double scaleY = (double) height / targetHeight;
        double[] out = new double[targetWidth * targetHeight];

        for (int ty = 0; ty < targetHeight; ty++) {
            double y0 = ty * scaleY;
            double y1 = y0 + scaleY;
            for (int tx = 0; tx < targetWidth; tx++) {
                double x0 = tx * scaleX;
                double x1 = x0 + scaleX;

                double sum = 0.0;
                double area = 0.0;
                for (int sy = (int) Math.floor(y0); sy < Math.min(height, (int) Math.ceil(y1)); sy++) {
                    double wy = Math.min(y1, sy + 1) - Math.max(y0, sy);
                    if (wy <= 0) continue;
                    for (int sx = (int) Math.floor(x0); sx < Math.min(width, (int) Math.ceil(x1)); sx++) {
                        double wx = Math.min(x1, sx + 1) - Math.max(x0, sx);
                        if (wx <= 0) continue;
                        double w = wx * wy;
                        sum += values[sy * width + sx] * w;
                        area += w;
                    }
                }
                out[ty * targetWidth + tx] = area > 0 ? sum / area : 0.0;
            }
        }
        return new PixelGrid(targetWidth, targetHeight, out, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelGrid)) return false;
        PixelGrid other = (PixelGrid) o;
        return width == other.width && height == other.height && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "PixelGrid[" + width + "x" + height + "]";
    }
}
