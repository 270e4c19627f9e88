package work.pollochang.dedup.image;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.index.IndexType;
import work.pollochang.dedup.image.report.DedupReport;
import work.pollochang.dedup.image.report.MajorityRefiner;
import work.pollochang.dedup.image.report.ReportWriter;
import work.pollochang.dedup.image.tools.FileTools;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "image-dedup",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "以感知雜湊找出相似或重複的圖片")
public class Execute implements Callable<Integer> {

    static class Source {
        @Option(names = {"-f", "--file-list"}, required = true, description = "包含圖片路徑的文字檔案，每行一個。")
        File fileList;

        @Option(names = {"-d", "--dir"}, required = true, description = "遞迴掃描此目錄下的圖片。")
        File directory;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Source source;

    @Option(names = {"-t", "--threshold"}, defaultValue = "4", description = "漢明距離門檻，距離不超過此值即視為相似 (預設: 4)。")
    private int threshold;

    @Option(names = {"-p", "--similarity"}, description = "以相似度百分比 (0~100) 指定門檻，會覆蓋 --threshold。")
    private Double similarity;

    @Option(names = {"-a", "--algorithm"}, defaultValue = "DHASH", description = "雜湊演算法: ${COMPLETION-CANDIDATES} (預設: DHASH)。")
    private HashAlgorithm algorithm;

    @Option(names = {"-s", "--hash-size"}, defaultValue = "8", description = "雜湊邊長，指紋長度為其平方 (預設: 8，即 64 位元)。")
    private int hashSize;

    @Option(names = {"--index"}, defaultValue = "MULTI_INDEX", description = "相似度索引: ${COMPLETION-CANDIDATES} (預設: MULTI_INDEX)。")
    private IndexType indexType;

    @Option(names = {"--threads"}, description = "計算指紋的執行緒數 (預設: CPU 核心數)。")
    private Integer threads;

    @Option(names = {"--timeOut"}, defaultValue = "24", description = "設定執行時間超時(小時) (預設: 24 小時)。")
    private long timeOutHr;

    @Option(names = {"--cache-db"}, description = "H2 指紋快取資料庫的檔案路徑；未指定時不使用快取。")
    private File h2DbFile;

    @Option(names = {"--report-json"}, description = "另將比對結果寫成 JSON 檔。")
    private File reportJson;

    @Option(names = {"--refine"}, description = "移出與群組過半成員距離超過門檻的圖片。")
    private boolean refine;

    @Option(names = {"--show-singletons"}, description = "報告中也列出沒有重複的圖片。")
    private boolean showSingletons;

    @Override
    public Integer call() throws Exception {
        List<Path> images;
        String sourceDescription;
        if (source.fileList != null) {
            sourceDescription = source.fileList.getAbsolutePath();
            images = FileTools.readFileList(source.fileList.toPath());
        } else {
            sourceDescription = source.directory.getAbsolutePath();
            images = FileTools.listImages(source.directory.toPath());
        }

        int bitLength = hashSize * hashSize;
        int effectiveThreshold = similarity != null
                ? DedupParams.thresholdForSimilarity(similarity, bitLength)
                : threshold;
        int workerCount = threads != null ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());

        log.info("========================================比對程式參數設定========================================");
        log.info("比對任務開始");
        log.info("圖片來源: {} (共 {} 張)", sourceDescription, images.size());
        log.info("雜湊演算法: {}，指紋長度: {} 位元", algorithm, bitLength);
        log.info("距離門檻: {}{}", effectiveThreshold, similarity != null ? " (相似度 " + similarity + "%)" : "");
        log.info("相似度索引: {}", indexType);
        log.info("執行緒數: {}", workerCount);
        log.info("設定超時執行時間: {} 小時", timeOutHr);
        log.info("指紋快取資料庫: {}", h2DbFile != null ? h2DbFile.getAbsolutePath() : "(未使用)");
        log.info("========================================比對程式參數設定========================================");

        DedupParams params = new DedupParams(effectiveThreshold, algorithm, hashSize, indexType, workerCount);

        DedupBatch dedupBatch = new DedupBatch();
        dedupBatch.setParams(params);
        dedupBatch.setTimeOutHr(timeOutHr);
        if (h2DbFile != null) {
            dedupBatch.setCachePath(h2DbFile.toPath());
        }
        DedupReport report = dedupBatch.execute(images);

        if (refine) {
            report = new MajorityRefiner(effectiveThreshold).refine(report);
        }

        ReportWriter writer = new ReportWriter(showSingletons);
        writer.logReport(report);
        if (reportJson != null) {
            writer.writeJson(report, reportJson.toPath());
        }

        log.info("所有任務執行完畢");
        return 0; // 成功時返回 0
    }

    /**
     * 建立命令列物件；執行期間的致命錯誤記錄後以結束碼 1 返回。
     */
    static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new Execute());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            log.error("比對任務失敗，中止執行", ex);
            return 1;
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
