package work.pollochang.dedup.image.cache;

/**
 * 快取檔頭無法解讀，連版本都無法判斷。屬於致命錯誤。
 */
public class CacheCorruptedException extends RuntimeException {

    public CacheCorruptedException(String message) {
        super(message);
    }

    public CacheCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
