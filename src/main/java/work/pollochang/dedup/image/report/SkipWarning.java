package work.pollochang.dedup.image.report;

import work.pollochang.dedup.image.core.ScanResult;

/**
 * 一張被略過的圖片與原因。
 */
public record SkipWarning(String identifier, ScanResult result, String reason) {}
