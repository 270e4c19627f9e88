package work.pollochang.dedup.image.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DifferenceHashExtractorTest {

    private final DifferenceHashExtractor extractor = new DifferenceHashExtractor();

    /**
     * 預設為 64 位元
     */
    @Test
    void testDefaultSize_ShouldProduce64Bits() {
        assertEquals(64, extractor.bitLength());
        assertEquals(HashAlgorithm.DHASH, extractor.algorithm());
        assertEquals(64, extractor.extract(SampleGrids.waves(32)).bitLength());
    }

    /**
     * 左亮右暗時每個位元都是 1，反之全為 0
     */
    @Test
    void testGradient_ShouldSetBitsWhereLeftIsBrighter() {
        Fingerprint leftBright = extractor.extract(SampleGrids.horizontalGradient(32, true));
        Fingerprint rightBright = extractor.extract(SampleGrids.horizontalGradient(32, false));

        assertEquals("1".repeat(64), leftBright.toBinaryString());
        assertEquals("0".repeat(64), rightBright.toBinaryString());
        assertEquals(64, leftBright.distance(rightBright));
    }

    /**
     * 相同輸入得到相同指紋
     */
    @Test
    void testExtract_ShouldBeDeterministic() {
        PixelGrid grid = SampleGrids.waves(32);
        assertEquals(extractor.extract(grid), extractor.extract(PixelGrid.of(32, 32, copyOf(grid))));
    }

    /**
     * 整體調亮、輕微雜訊與不同解析度都不應讓指紋差太多
     */
    @Test
    void testSimilarImages_ShouldStayWithinSmallDistance() {
        Fingerprint base = extractor.extract(SampleGrids.waves(32));

        assertEquals(0, base.distance(extractor.extract(SampleGrids.brighten(SampleGrids.waves(32), 10))));
        assertTrue(base.distance(extractor.extract(SampleGrids.jitter(SampleGrids.waves(32)))) <= 4);
        assertTrue(base.distance(extractor.extract(SampleGrids.waves(64))) <= 4);
    }

    /**
     * 內容不同的圖片距離明顯較大
     */
    @Test
    void testDifferentImages_ShouldBeFarApart() {
        Fingerprint a = extractor.extract(SampleGrids.waves(32));
        Fingerprint b = extractor.extract(SampleGrids.otherWaves(32));
        assertTrue(a.distance(b) > 16, "distance = " + a.distance(b));
    }

    /**
     * hashSize = 16 時為 256 位元
     */
    @Test
    void testLargerHashSize_ShouldProduce256Bits() {
        DifferenceHashExtractor large = new DifferenceHashExtractor(16);
        assertEquals(256, large.bitLength());
        Fingerprint fp = large.extract(SampleGrids.waves(32));
        assertEquals(256, fp.bitLength());
        assertTrue(fp.distance(large.extract(SampleGrids.jitter(SampleGrids.waves(32)))) <= 8);
    }

    @Test
    void testInvalidHashSize_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new DifferenceHashExtractor(1));
    }

    private static double[] copyOf(PixelGrid grid) {
        double[] values = new double[grid.width() * grid.height()];
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                values[y * grid.width() + x] = grid.get(x, y);
            }
        }
        return values;
    }
}
