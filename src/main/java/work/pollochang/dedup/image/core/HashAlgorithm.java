package work.pollochang.dedup.image.core;

/**
 * 支援的感知雜湊演算法。
 * <p>
 * 名稱會寫入快取簽章；變更任何一種演算法的運算方式都必須同步提高
 * {@link work.pollochang.dedup.image.cache.CacheSignature#FORMAT_VERSION}。
 */
public enum HashAlgorithm {
    DHASH("差異雜湊 (相鄰像素亮度比較)"),
    PHASH("感知雜湊 (DCT 低頻係數與中位數比較)");

    private final String description;

    HashAlgorithm(String description) { this.description = description; }

    public String getDescription() { return description; }

    /**
     * 建立指定邊長的擷取器，指紋長度為 {@code hashSize * hashSize}。
     */
    public HashExtractor newExtractor(int hashSize) {
        switch (this) {
            case DHASH:
                return new DifferenceHashExtractor(hashSize);
            case PHASH:
                return new PerceptualHashExtractor(hashSize);
            default:
                throw new IllegalStateException("未知的演算法: " + this);
        }
    }
}
