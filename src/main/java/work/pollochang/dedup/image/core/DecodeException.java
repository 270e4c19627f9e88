package work.pollochang.dedup.image.core;

import lombok.Getter;

/**
 * 單張圖片解碼失敗。呼叫端應略過該圖片並記錄警告，不可中止整個批次。
 */
@Getter
public class DecodeException extends Exception {

    private final String reason;

    public DecodeException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public DecodeException(String reason, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
    }
}
