package work.pollochang.dedup.image.index;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.core.Fingerprint;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 多重索引雜湊 (multi-index hashing)。
 * <p>
 * L 位元的指紋切成 m 個互不重疊的連續區段，每段各有一張「區段值 → 條目序號」的雜湊表。
 * 若兩個指紋距離 &lt;= T，依鴿籠原理至少有一段的距離 &lt;= floor(T / m)。
 * 查詢時對每一段探測所有與查詢值相差不超過 r = floor(T / m) 位元的區段值，
 * 只對落在這些桶中的候選做完整距離比較，因此不會遺漏。
 * <p>
 * 預設 m = maxThreshold + 1 (每段上限 64 位元)，此時 T &lt;= maxThreshold 的查詢只需精確比對區段值。
 * 當探測數量超過已索引的條目數時，改為線性掃描。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class MultiIndexHashIndex extends AbstractSimilarityIndex {

    private final int[] blockStart;
    private final int[] blockWidth;
    private final List<Map<Long, List<Integer>>> tables;

    /**
     * @param bitLength    指紋位元數
     * @param maxThreshold 預期的最大查詢距離，決定分段數
     */
    public MultiIndexHashIndex(int bitLength, int maxThreshold) {
        super(bitLength);
        if (maxThreshold < 0) {
            throw new IllegalArgumentException("maxThreshold 不可為負: " + maxThreshold);
        }
        int minBlocks = (bitLength + 63) / 64;
        int blocks = (int) Math.max(minBlocks, Math.min((long) maxThreshold + 1, bitLength));

        this.blockStart = new int[blocks];
        this.blockWidth = new int[blocks];
        int base = bitLength / blocks;
        int extra = bitLength % blocks;
        int start = 0;
        for (int b = 0; b < blocks; b++) {
            blockStart[b] = start;
            blockWidth[b] = base + (b < extra ? 1 : 0);
            start += blockWidth[b];
        }

        this.tables = new ArrayList<>(blocks);
        for (int b = 0; b < blocks; b++) {
            tables.add(new HashMap<>());
        }
        log.debug("多重索引雜湊: {} 位元切成 {} 段，每段 {}~{} 位元", bitLength, blocks, base, base + (extra > 0 ? 1 : 0));
    }

    public int blockCount() {
        return blockStart.length;
    }

    @Override
    protected void onInsert(int ordinal, Fingerprint fingerprint) {
        for (int b = 0; b < blockStart.length; b++) {
            long key = fingerprint.bits(blockStart[b], blockWidth[b]);
            tables.get(b).computeIfAbsent(key, k -> new ArrayList<>()).add(ordinal);
        }
    }

    @Override
    protected void collect(Fingerprint query, int threshold, List<Neighbor> out) {
        int entries = entryCount();
        if (entries == 0) {
            return;
        }

        int radius = threshold / blockStart.length;
        if (probeCount(radius) > entries) {
            log.trace("探測數量超過條目數 {}，改用線性掃描", entries);
            for (int ordinal = 0; ordinal < entries; ordinal++) {
                compare(ordinal, query, threshold, out);
            }
            return;
        }

        BitSet seen = new BitSet(entries);
        for (int b = 0; b < blockStart.length; b++) {
            long key = query.bits(blockStart[b], blockWidth[b]);
            probe(tables.get(b), blockWidth[b], key, 0, radius, query, threshold, seen, out);
        }
    }

    /**
     * 探測所有與 {@code key} 相差不超過 {@code remaining} 個位元 (只翻轉 {@code fromBit} 之後的位元) 的區段值。
     * 遞迴深度不超過 radius。
     */
    private void probe(Map<Long, List<Integer>> table, int width, long key, int fromBit, int remaining,
                       Fingerprint query, int threshold, BitSet seen, List<Neighbor> out) {
        List<Integer> bucket = table.get(key);
        if (bucket != null) {
            for (int ordinal : bucket) {
                if (!seen.get(ordinal)) {
                    seen.set(ordinal);
                    compare(ordinal, query, threshold, out);
                }
            }
        }
        if (remaining == 0) {
            return;
        }
        for (int bit = fromBit; bit < width; bit++) {
            probe(table, width, key ^ (1L << bit), bit + 1, remaining - 1, query, threshold, seen, out);
        }
    }

    /**
     * 所有區段在半徑 r 內的探測總數 (以 double 計算避免溢位)。
     */
    private double probeCount(int radius) {
        double total = 0;
        for (int width : blockWidth) {
            double combinations = 1;
            double sum = 1;
            for (int k = 1; k <= Math.min(radius, width); k++) {
                combinations = combinations * (width - k + 1) / k;
                sum += combinations;
            }
            total += sum;
        }
        return total;
    }
}
