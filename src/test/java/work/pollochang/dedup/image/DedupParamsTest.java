package work.pollochang.dedup.image;

import org.junit.jupiter.api.Test;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.index.IndexType;

import static org.junit.jupiter.api.Assertions.*;

class DedupParamsTest {

    /**
     * 相似度百分比換算為距離門檻
     */
    @Test
    void testThresholdForSimilarity_ShouldRoundToNearestBit() {
        assertEquals(0, DedupParams.thresholdForSimilarity(100, 64));
        assertEquals(64, DedupParams.thresholdForSimilarity(0, 64));
        assertEquals(6, DedupParams.thresholdForSimilarity(90, 64));
        assertEquals(26, DedupParams.thresholdForSimilarity(90, 256));
        assertThrows(IllegalArgumentException.class, () -> DedupParams.thresholdForSimilarity(101, 64));
    }

    /**
     * 非數字的百分比不可被當成 0 位元門檻
     */
    @Test
    void testThresholdForNaN_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> DedupParams.thresholdForSimilarity(Double.NaN, 64));
        assertThrows(IllegalArgumentException.class, () -> DedupParams.thresholdForSimilarity(-0.5, 64));
    }

    /**
     * 未指定演算法與索引時使用預設值
     */
    @Test
    void testNullChoices_ShouldFallBackToDefaults() {
        DedupParams params = new DedupParams(3, null, 16, null, 2);
        assertEquals(HashAlgorithm.DHASH, params.algorithm());
        assertEquals(IndexType.MULTI_INDEX, params.indexType());
        assertEquals(256, params.bitLength());
        assertEquals(256, params.newExtractor().bitLength());
    }

    @Test
    void testInvalidValues_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new DedupParams(-1, HashAlgorithm.DHASH, 8, IndexType.LINEAR, 1));
        assertThrows(IllegalArgumentException.class, () -> new DedupParams(4, HashAlgorithm.DHASH, 1, IndexType.LINEAR, 1));
        assertThrows(IllegalArgumentException.class, () -> new DedupParams(4, HashAlgorithm.DHASH, 8, IndexType.LINEAR, 0));
    }
}
