package work.pollochang.dedup.image.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.group.DuplicateGroup;
import work.pollochang.dedup.image.group.SimilarityEdge;
import work.pollochang.dedup.image.tools.FileTools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 輸出比對結果：以日誌列出摘要與群組，並可另存 JSON 檔。
 * <p>
 * 顯示用的排序 (群組由大到小) 只在這裡進行，不影響核心結果。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ReportWriter {

    /** JSON 報告中的單一群組 */
    public record GroupView(int size, boolean identical, int maxDistance, List<String> members, List<EdgeView> edges) {}

    /** JSON 報告中的一條相似邊 */
    public record EdgeView(String first, String second, int distance) {}

    /** JSON 報告的根物件 */
    public record ReportView(int threshold,
                             int bitLength,
                             boolean cancelled,
                             int totalImages,
                             int fingerprinted,
                             int cacheHits,
                             int skippedCount,
                             Map<String, Long> skippedByReason,
                             List<SkipWarning> skipped,
                             List<String> cacheWarnings,
                             List<GroupView> groups,
                             Map<String, String> fingerprints) {}

    private final boolean showSingletons;
    private final ObjectMapper mapper;

    public ReportWriter(boolean showSingletons) {
        this.showSingletons = showSingletons;
        this.mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    /**
     * 將報告以日誌輸出。
     */
    public void logReport(DedupReport report) {
        List<DuplicateGroup> shown = displayOrder(report);

        int groupNo = 0;
        for (DuplicateGroup group : shown) {
            groupNo++;
            if (!group.isDuplicate()) {
                log.info("[單張 {}] {}", groupNo, group.members().get(0));
                continue;
            }
            log.info("[群組 {}] {} 張，{}，最大邊距離 {}", groupNo, group.size(),
                    group.isIdentical() ? "指紋完全相同" : "相似", group.maxEdgeDistance());
            for (String member : group.members()) {
                log.info("    {}", member);
            }
            for (SimilarityEdge edge : group.edges()) {
                log.debug("    距離 {}: {} <-> {}", edge.distance(), edge.first(), edge.second());
            }
        }

        if (!report.skipped().isEmpty()) {
            log.warn("共略過 {} 張圖片:", report.skippedCount());
            for (SkipWarning warning : report.skipped()) {
                log.warn("    {} - {}: {}", warning.identifier(), warning.result().getDescription(), warning.reason());
            }
        }
        for (String warning : report.cacheWarnings()) {
            log.warn("快取警告: {}", warning);
        }

        log.info("========================================比對結果報告========================================");
        if (report.cancelled()) {
            log.warn(" 執行已取消，未進行分群");
        }
        log.info(" 輸入圖片: {}", report.totalImages());
        log.info(" 取得指紋: {} (沿用快取 {})", report.fingerprintedCount(), report.cacheHits());
        log.info(" 略過圖片: {}", report.skippedCount());
        skippedByReason(report).forEach((reason, count) -> log.info("     {}: {}", reason, count));
        log.info(" 距離門檻: {} / {} 位元", report.threshold(), report.bitLength());
        log.info(" 重複群組: {} 組，涉及 {} 張圖片", report.duplicateGroups().size(), report.duplicateImageCount());
        log.info("========================================比對結果報告========================================");
    }

    /**
     * 將報告寫成 JSON 檔。
     *
     * @throws IOException 寫入失敗
     */
    public void writeJson(DedupReport report, Path path) throws IOException {
        List<GroupView> groups = new ArrayList<>();
        for (DuplicateGroup group : displayOrder(report)) {
            List<EdgeView> edges = group.edges().stream()
                    .map(e -> new EdgeView(e.first(), e.second(), e.distance()))
                    .collect(Collectors.toList());
            groups.add(new GroupView(group.size(), group.isIdentical(), group.maxEdgeDistance(), group.members(), edges));
        }

        Map<String, String> fingerprints = new LinkedHashMap<>();
        report.fingerprints().forEach((id, fp) -> fingerprints.put(id, fp.toHex()));

        ReportView view = new ReportView(
                report.threshold(),
                report.bitLength(),
                report.cancelled(),
                report.totalImages(),
                report.fingerprintedCount(),
                report.cacheHits(),
                report.skippedCount(),
                skippedByReason(report),
                report.skipped(),
                report.cacheWarnings(),
                groups,
                fingerprints);

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            FileTools.ensureDirectoryExists(parent);
        }
        log.info("正在將比對結果寫入 {} ...", path);
        mapper.writeValue(path.toFile(), view);
        log.info("比對結果成功儲存。");
    }

    private List<DuplicateGroup> displayOrder(DedupReport report) {
        return report.groups().stream()
                .filter(g -> showSingletons || g.isDuplicate())
                .sorted(Comparator.comparingInt(DuplicateGroup::size).reversed())
                .collect(Collectors.toList());
    }

    private static Map<String, Long> skippedByReason(DedupReport report) {
        return report.skipped().stream()
                .collect(Collectors.groupingBy(w -> w.result().name(), TreeMap::new, Collectors.counting()));
    }
}
