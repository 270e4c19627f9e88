package work.pollochang.dedup.image.core;

/**
 * 差異雜湊 (dHash)。
 * <p>
 * 演算法 (固定，為快取格式的一部分)：
 * <ol>
 *   <li>以面積平均將像素格縮為 (s+1) x s。</li>
 *   <li>第 r 列第 c 欄 (0 &lt;= r, c &lt; s) 產生位元 {@code r * s + c}，
 *       當左格 (c, r) 比右格 (c+1, r) 亮時為 1。</li>
 * </ol>
 * 指紋長度為 s²；預設 s = 8，即 64 位元。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class DifferenceHashExtractor implements HashExtractor {

    public static final int DEFAULT_HASH_SIZE = 8;

    private final int hashSize;

    public DifferenceHashExtractor() {
        this(DEFAULT_HASH_SIZE);
    }

    public DifferenceHashExtractor(int hashSize) {
        if (hashSize < 2) {
            throw new IllegalArgumentException("hashSize 至少為 2: " + hashSize);
        }
        this.hashSize = hashSize;
    }

    @Override
    public Fingerprint extract(PixelGrid grid) {
        PixelGrid small = grid.resample(hashSize + 1, hashSize);
        boolean[] bits = new boolean[hashSize * hashSize];
        for (int row = 0; row < hashSize; row++) {
            for (int col = 0; col < hashSize; col++) {
                bits[row * hashSize + col] = small.get(col, row) > small.get(col + 1, row);
            }
        }
        return Fingerprint.fromBits(bits);
    }

    @Override
    public HashAlgorithm algorithm() {
        return HashAlgorithm.DHASH;
    }

    @Override
    public int bitLength() {
        return hashSize * hashSize;
    }
}
