package work.pollochang.dedup.image.core;

/**
 * 測試用的像素格產生器，使用平滑的波紋圖樣，讓縮放後的相鄰格仍有明顯的亮度差。
 */
final class SampleGrids {

    private SampleGrids() {
    }

    static PixelGrid waves(int n) {
        double[] values = new double[n * n];
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                double fx = (double) x / n;
                double fy = (double) y / n;
                values[y * n + x] = 128 + 90 * Math.sin(2 * Math.PI * (fx * 1.3)) * Math.cos(2 * Math.PI * fy * 0.9) + 30 * fx;
            }
        }
        return PixelGrid.of(n, n, values);
    }

    static PixelGrid otherWaves(int n) {
        double[] values = new double[n * n];
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                double fx = (double) x / n;
                double fy = (double) y / n;
                values[y * n + x] = 128 + 90 * Math.cos(2 * Math.PI * fx * 2.1) * Math.sin(2 * Math.PI * (fy * 1.7 + 0.2)) - 40 * fy;
            }
        }
        return PixelGrid.of(n, n, values);
    }

    /** 每個像素加上 -4~+4 的固定擾動 */
    static PixelGrid jitter(PixelGrid grid) {
        int w = grid.width();
        int h = grid.height();
        double[] values = new double[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = grid.get(x, y) + ((x * 7 + y * 13) % 9) - 4;
                values[y * w + x] = Math.min(255, Math.max(0, v));
            }
        }
        return PixelGrid.of(w, h, values);
    }

    static PixelGrid brighten(PixelGrid grid, double delta) {
        int w = grid.width();
        int h = grid.height();
        double[] values = new double[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                values[y * w + x] = grid.get(x, y) + delta;
            }
        }
        return PixelGrid.of(w, h, values);
    }

    /** 水平漸層；leftBright 為 true 時左亮右暗 */
    static PixelGrid horizontalGradient(int n, boolean leftBright) {
        double[] values = new double[n * n];
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                double v = x * (240.0 / n);
                values[y * n + x] = leftBright ? 255 - v : v;
            }
        }
        return PixelGrid.of(n, n, values);
    }
}
