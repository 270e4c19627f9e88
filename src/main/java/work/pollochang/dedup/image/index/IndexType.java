package work.pollochang.dedup.image.index;

public enum IndexType {
    MULTI_INDEX("多重索引雜湊"),
    BK_TREE("BK 樹"),
    LINEAR("線性掃描");

    private final String description;
    IndexType(String description) { this.description = description; }
    public String getDescription() { return description; }

    /**
     * @param bitLength    指紋位元數
     * @param maxThreshold 預期的最大查詢距離，只影響多重索引雜湊的分段數
     */
    public SimilarityIndex create(int bitLength, int maxThreshold) {
        switch (this) {
            case MULTI_INDEX:
                return new MultiIndexHashIndex(bitLength, maxThreshold);
            case BK_TREE:
                return new BkTreeIndex(bitLength);
            case LINEAR:
                return new LinearScanIndex(bitLength);
            default:
                throw new IllegalStateException("未知的索引類型: " + this);
        }
    }
}
