package work.pollochang.dedup.image.cache;

import work.pollochang.dedup.image.core.HashAlgorithm;

/**
 * 快取內容的格式簽章。任何一個欄位不同，快取中的指紋就不可與目前的指紋比較。
 *
 * @param formatVersion 快取格式與雜湊運算方式的版本
 * @param algorithm     雜湊演算法名稱
 * @param bitLength     指紋位元數
 */
public record CacheSignature(int formatVersion, String algorithm, int bitLength) {

    /** 變更資料表結構或任何雜湊運算細節時必須遞增 */
    public static final int FORMAT_VERSION = 1;

    public static CacheSignature of(HashAlgorithm algorithm, int bitLength) {
        return new CacheSignature(FORMAT_VERSION, algorithm.name(), bitLength);
    }

    public String describe() {
        return "v" + formatVersion + "/" + algorithm + "/" + bitLength + "bit";
    }
}
