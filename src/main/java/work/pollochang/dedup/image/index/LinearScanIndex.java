package work.pollochang.dedup.image.index;

import work.pollochang.dedup.image.core.Fingerprint;

import java.util.List;

/**
 * 逐筆比較的索引。作為其他索引的正確性基準，也適合少量圖片。
 */
public class LinearScanIndex extends AbstractSimilarityIndex {

    public LinearScanIndex(int bitLength) {
        super(bitLength);
    }

    @Override
    protected void onInsert(int ordinal, Fingerprint fingerprint) {
        // 條目本身就是全部的查找結構
    }

    @Override
    protected void collect(Fingerprint query, int threshold, List<Neighbor> out) {
        for (int ordinal = 0; ordinal < entryCount(); ordinal++) {
            compare(ordinal, query, threshold, out);
        }
    }
}
