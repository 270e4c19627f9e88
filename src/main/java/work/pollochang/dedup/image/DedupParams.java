package work.pollochang.dedup.image;

import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.core.HashExtractor;
import work.pollochang.dedup.image.index.IndexType;

/**
 * 一次比對執行的參數。
 *
 * @param threshold  漢明距離門檻 (含)，以指紋位元為單位
 * @param algorithm  雜湊演算法
 * @param hashSize   雜湊邊長，指紋長度為其平方
 * @param indexType  相似度索引的實作
 * @param threads    計算指紋的執行緒數
 */
public record DedupParams(int threshold, HashAlgorithm algorithm, int hashSize, IndexType indexType, int threads) {

    public static final int DEFAULT_THRESHOLD = 4;
    public static final int DEFAULT_HASH_SIZE = 8;

    public DedupParams {
        if (threshold < 0) {
            throw new IllegalArgumentException("距離門檻不可為負: " + threshold);
        }
        if (hashSize < 2) {
            throw new IllegalArgumentException("雜湊邊長至少為 2: " + hashSize);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("執行緒數至少為 1: " + threads);
        }
        if (algorithm == null) algorithm = HashAlgorithm.DHASH;
        if (indexType == null) indexType = IndexType.MULTI_INDEX;
    }

    public static DedupParams defaults() {
        return new DedupParams(DEFAULT_THRESHOLD, HashAlgorithm.DHASH, DEFAULT_HASH_SIZE, IndexType.MULTI_INDEX,
                Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    public int bitLength() {
        return hashSize * hashSize;
    }

    public HashExtractor newExtractor() {
        return algorithm.newExtractor(hashSize);
    }

    /**
     * 將相似度百分比換算為距離門檻：100% 為 0，0% 為全部位元。
     */
    public static int thresholdForSimilarity(double percentage, int bitLength) {
        if (Double.isNaN(percentage) || percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("相似度百分比必須介於 0 到 100: " + percentage);
        }
        return (int) Math.round(bitLength * (100.0 - percentage) / 100.0);
    }
}
