package work.pollochang.dedup.image.report;

import work.pollochang.dedup.image.core.Fingerprint;
import work.pollochang.dedup.image.group.DuplicateGroup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 一次比對執行的完整結果。略過的圖片與重複群組分開記錄。
 *
 * @param threshold     使用的距離門檻
 * @param bitLength     指紋位元數
 * @param groups        涵蓋所有成功取得指紋之圖片的群組 (含單張群組)；取消時為空
 * @param fingerprints  識別字 → 指紋，依插入順序
 * @param skipped       被略過的圖片
 * @param cacheWarnings 快取相關警告
 * @param totalImages   輸入的圖片數
 * @param cacheHits     沿用快取指紋的圖片數
 * @param cancelled     是否在分群前被取消
 */
public record DedupReport(int threshold,
                          int bitLength,
                          List<DuplicateGroup> groups,
                          Map<String, Fingerprint> fingerprints,
                          List<SkipWarning> skipped,
                          List<String> cacheWarnings,
                          int totalImages,
                          int cacheHits,
                          boolean cancelled) {

    public DedupReport {
        groups = List.copyOf(groups);
        fingerprints = Collections.unmodifiableMap(new LinkedHashMap<>(fingerprints));
        skipped = List.copyOf(skipped);
        cacheWarnings = List.copyOf(cacheWarnings);
    }

    /** 只包含兩張以上圖片的群組 */
    public List<DuplicateGroup> duplicateGroups() {
        return groups.stream().filter(DuplicateGroup::isDuplicate).collect(Collectors.toList());
    }

    public int fingerprintedCount() {
        return fingerprints.size();
    }

    public int skippedCount() {
        return skipped.size();
    }

    /** 出現在重複群組中的圖片數 */
    public int duplicateImageCount() {
        return duplicateGroups().stream().mapToInt(DuplicateGroup::size).sum();
    }

    /**
     * 以新的群組取代原本的群組，用於報表層的後處理。
     */
    public DedupReport withGroups(List<DuplicateGroup> newGroups) {
        return new DedupReport(threshold, bitLength, newGroups, fingerprints, skipped, cacheWarnings,
                totalImages, cacheHits, cancelled);
    }
}
