package work.pollochang.dedup.image.store;

import work.pollochang.dedup.image.core.Fingerprint;

import java.util.Objects;

/**
 * 一張成功取得指紋的圖片。建立後不可變，由 {@link FingerprintStore} 獨佔持有。
 *
 * @param identifier  呼叫端提供的識別字 (通常為檔案路徑)
 * @param fingerprint 指紋
 * @param metadata    附加資訊，不可為 null，未知時使用 {@link ImageMetadata#UNKNOWN}
 */
public record ImageRecord(String identifier, Fingerprint fingerprint, ImageMetadata metadata) {

    public ImageRecord {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }
}
