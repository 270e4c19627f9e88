package work.pollochang.dedup.image.core;

import java.util.Arrays;

/**
 * 以 DCT 為基礎的感知雜湊 (pHash)。
 * <p>
 * 演算法 (固定，為快取格式的一部分)：
 * <ol>
 *   <li>以面積平均將像素格縮為 N x N，N = 4s。</li>
 *   <li>計算二維 DCT-II，只保留左上角 s x s 的低頻係數
 *       (垂直頻率 v 為列、水平頻率 u 為欄)。</li>
 *   <li>取這 s² 個係數中排除直流項 (0, 0) 後的中位數。</li>
 *   <li>位元 {@code v * s + u} 在係數大於中位數時為 1。</li>
 * </ol>
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class PerceptualHashExtractor implements HashExtractor {

    public static final int DEFAULT_HASH_SIZE = 8;

    private final int hashSize;
    private final int size;
    // cosines[x][u] = cos((2x + 1) * u * PI / 2N)
    private final double[][] cosines;
    private final double[] coeff;

    public PerceptualHashExtractor() {
        this(DEFAULT_HASH_SIZE);
    }

    public PerceptualHashExtractor(int hashSize) {
        if (hashSize < 2) {
            throw new IllegalArgumentException("hashSize 至少為 2: " + hashSize);
        }
        this.hashSize = hashSize;
        this.size = hashSize * 4;

        this.cosines = new double[size][hashSize];
        for (int x = 0; x < size; x++) {
            for (int u = 0; u < hashSize; u++) {
                cosines[x][u] = StrictMath.cos(((2 * x + 1) / (2.0 * size)) * u * StrictMath.PI);
            }
        }
        this.coeff = new double[hashSize];
        coeff[0] = 1 / StrictMath.sqrt(2.0);
        for (int u = 1; u < hashSize; u++) {
            coeff[u] = 1;
        }
    }

    @Override
    public Fingerprint extract(PixelGrid grid) {
        PixelGrid small = grid.resample(size, size);
        double[][] dct = lowFrequencyDct(small);

        double[] acTerms = new double[hashSize * hashSize - 1];
        int k = 0;
        for (int v = 0; v < hashSize; v++) {
            for (int u = 0; u < hashSize; u++) {
                if (u == 0 && v == 0) continue;
                acTerms[k++] = dct[v][u];
            }
        }
        Arrays.sort(acTerms);
        int mid = acTerms.length / 2;
        double median = (acTerms.length & 1) == 1 ? acTerms[mid] : (acTerms[mid - 1] + acTerms[mid]) / 2.0;

        boolean[] bits = new boolean[hashSize * hashSize];
        for (int v = 0; v < hashSize; v++) {
            for (int u = 0; u < hashSize; u++) {
                bits[v * hashSize + u] = dct[v][u] > median;
            }
        }
        return Fingerprint.fromBits(bits);
    }

    /**
     * 可分離的 DCT-II：先對每一列做水平轉換，再對每一欄做垂直轉換，只計算前 s 個頻率。
     */
    private double[][] lowFrequencyDct(PixelGrid grid) {
        double[][] rows = new double[size][hashSize];
        for (int y = 0; y < size; y++) {
            for (int u = 0; u < hashSize; u++) {
                double sum = 0.0;
                for (int x = 0; x < size; x++) {
                    sum += cosines[x][u] * grid.get(x, y);
                }
                rows[y][u] = sum;
            }
        }

        double[][] result = new double[hashSize][hashSize];
        for (int v = 0; v < hashSize; v++) {
            for (int u = 0; u < hashSize; u++) {
                double sum = 0.0;
                for (int y = 0; y < size; y++) {
                    sum += cosines[y][v] * rows[y][u];
                }
                result[v][u] = sum * coeff[u] * coeff[v] / 4.0;
            }
        }
        return result;
    }

    @Override
    public HashAlgorithm algorithm() {
        return HashAlgorithm.PHASH;
    }

    @Override
    public int bitLength() {
        return hashSize * hashSize;
    }
}
