package work.pollochang.dedup.image.cache;

import java.util.List;
import java.util.Map;

/**
 * 快取載入結果。
 *
 * @param entries  識別字 → 快取指紋
 * @param warnings 載入過程產生的警告，例如版本不符而整份捨棄
 */
public record CacheLoadResult(Map<String, CachedFingerprint> entries, List<String> warnings) {

    public CacheLoadResult {
        entries = Map.copyOf(entries);
        warnings = List.copyOf(warnings);
    }

    public static CacheLoadResult empty() {
        return new CacheLoadResult(Map.of(), List.of());
    }
}
