package work.pollochang.dedup.image.cache;

import work.pollochang.dedup.image.core.Fingerprint;
import work.pollochang.dedup.image.store.ImageMetadata;

/**
 * 快取中的一筆指紋與計算當時的檔案資訊。
 */
public record CachedFingerprint(Fingerprint fingerprint, ImageMetadata metadata) {

    /**
     * 檔案大小與修改時間都相同時才可沿用。
     */
    public boolean matches(ImageMetadata current) {
        return current != null && current.isKnown() && current.equals(metadata);
    }
}
