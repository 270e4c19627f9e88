package work.pollochang.dedup.image.core;

public enum ScanResult {
    FINGERPRINTED("計算指紋成功"),
    CACHE_HIT("沿用快取指紋"),
    SKIPPED_NOT_FOUND("來源檔案不存在"),
    SKIPPED_CANCELLED("執行已取消，未處理"),
    FAILED_DECODE("無法解碼"),
    FAILED_IO_ERROR("IO錯誤"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_TIMEOUT("處理逾時"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    ScanResult(String description) { this.description = description; }
    public String getDescription() { return description; }

    /** 是否產生了可用的指紋 */
    public boolean isSuccess() { return this == FINGERPRINTED || this == CACHE_HIT; }
}
