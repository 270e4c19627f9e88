package work.pollochang.dedup.image.tools;

import work.pollochang.dedup.image.core.PixelGrid;

import java.awt.image.BufferedImage;

public class ImageTools {

    /**
     * 將圖片轉為灰階並以面積平均縮放成正方形像素格。
     * <p>
     * 灰階採 ITU-R BT.601 亮度權重；帶透明度的像素先與白色背景合成。
     *
     * @param image    原始圖片
     * @param gridSize 輸出邊長
     * @return 正規化後的像素格
     */
    public static PixelGrid toGrayscaleGrid(BufferedImage image, int gridSize) {
        int width = image.getWidth();
        int height = image.getHeight();
        boolean hasAlpha = image.getColorModel().hasAlpha();

        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        double[] luma = new double[width * height];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            double r = (p >> 16) & 0xFF;
            double g = (p >> 8) & 0xFF;
            double b = p & 0xFF;
            double y = 0.299 * r + 0.587 * g + 0.114 * b;
            if (hasAlpha) {
                double a = ((p >>> 24) & 0xFF) / 255.0;
                y = y * a + 255.0 * (1.0 - a);
            }
            luma[i] = y;
        }
        return PixelGrid.of(width, height, luma).resample(gridSize, gridSize);
    }
}
