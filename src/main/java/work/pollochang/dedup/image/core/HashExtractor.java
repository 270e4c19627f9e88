package work.pollochang.dedup.image.core;

/**
 * 將正規化像素格轉換為固定長度指紋。
 * <p>
 * 實作必須是純函式：相同輸入永遠得到位元完全相同的指紋，且不可保留任何狀態。
 */
public interface HashExtractor {

    Fingerprint extract(PixelGrid grid);

    HashAlgorithm algorithm();

    /** 產生的指紋位元數 */
    int bitLength();
}
