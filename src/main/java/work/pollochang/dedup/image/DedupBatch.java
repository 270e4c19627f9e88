package work.pollochang.dedup.image;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.cache.CacheLoadResult;
import work.pollochang.dedup.image.cache.CacheSignature;
import work.pollochang.dedup.image.cache.CachedFingerprint;
import work.pollochang.dedup.image.cache.FingerprintCache;
import work.pollochang.dedup.image.core.DecodeException;
import work.pollochang.dedup.image.core.Fingerprint;
import work.pollochang.dedup.image.core.HashExtractor;
import work.pollochang.dedup.image.core.ImageDecoder;
import work.pollochang.dedup.image.core.ImageIoDecoder;
import work.pollochang.dedup.image.core.PixelGrid;
import work.pollochang.dedup.image.core.ScanResult;
import work.pollochang.dedup.image.group.DuplicateGroup;
import work.pollochang.dedup.image.group.DuplicateGrouper;
import work.pollochang.dedup.image.index.SimilarityIndex;
import work.pollochang.dedup.image.report.DedupReport;
import work.pollochang.dedup.image.report.SkipWarning;
import work.pollochang.dedup.image.store.FingerprintStore;
import work.pollochang.dedup.image.store.ImageMetadata;
import work.pollochang.dedup.image.store.ImageRecord;
import work.pollochang.dedup.image.tools.FileTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 進行批次比對
 * <p>
 * 流程：
 * <ol>
 *   <li>載入指紋快取 (若有指定)。</li>
 *   <li>以固定大小執行緒池平行解碼並計算指紋；工作執行緒只回傳結果，不碰指紋倉庫。</li>
 *   <li>協調執行緒依輸入順序逐一取回結果並寫入倉庫 (單一寫入者)，插入順序與排程無關。</li>
 *   <li>批次建立相似度索引，單執行緒分群。</li>
 *   <li>寫回快取，組出報告。</li>
 * </ol>
 * 單張圖片的失敗只會成為警告，不會中止整個批次。
 */
@Setter
@Slf4j
public class DedupBatch {

    private DedupParams params = DedupParams.defaults();
    private ImageDecoder imageDecoder = new ImageIoDecoder();
    private Path cachePath;
    private long timeOutHr = 24;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** 單張圖片的處理結果，由工作執行緒產生 */
    private record ExtractionOutcome(String identifier, ScanResult result, Fingerprint fingerprint,
                                     ImageMetadata metadata, String reason) {

        static ExtractionOutcome success(String identifier, ScanResult result, Fingerprint fingerprint, ImageMetadata metadata) {
            return new ExtractionOutcome(identifier, result, fingerprint, metadata, null);
        }

        static ExtractionOutcome failed(String identifier, ScanResult result, String reason) {
            return new ExtractionOutcome(identifier, result, null, null, reason);
        }

        static ExtractionOutcome abandoned(String identifier) {
            return failed(identifier, ScanResult.SKIPPED_CANCELLED, "已取消，未開始處理");
        }
    }

    /**
     * 要求取消。尚未開始的圖片直接放棄，進行中的圖片做完或放棄，分群不會開始。
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("收到取消要求，將在目前的圖片處理完畢後停止。");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @param images 依此順序插入指紋倉庫的圖片路徑
     * @return 比對報告
     * @throws work.pollochang.dedup.image.store.DuplicateIdentifierException 同一路徑出現兩次
     * @throws work.pollochang.dedup.image.cache.CacheCorruptedException     快取檔頭無法解讀
     */
    public DedupReport execute(List<Path> images) {
        Objects.requireNonNull(images, "images must not be null");
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(imageDecoder, "imageDecoder must not be null");

        HashExtractor extractor = params.newExtractor();
        log.info("使用 {} ({})，指紋長度 {} 位元，距離門檻 {}，索引 {}",
                extractor.algorithm(), extractor.algorithm().getDescription(), extractor.bitLength(),
                params.threshold(), params.indexType().getDescription());

        FingerprintCache cache = null;
        CacheLoadResult loaded = CacheLoadResult.empty();
        if (cachePath != null) {
            cache = new FingerprintCache(cachePath, CacheSignature.of(extractor.algorithm(), extractor.bitLength()));
            log.info("指紋快取: {}，簽章 {}", cachePath, cache.signature().describe());
        } else {
            log.info("未指定快取檔案，所有圖片都將重新計算指紋。");
        }

        try {
            if (cache != null) {
                loaded = cache.loadAll();
            }

            FingerprintStore store = new FingerprintStore();
            List<SkipWarning> skipped = new ArrayList<>();
            Map<ScanResult, Integer> counters = new EnumMap<>(ScanResult.class);

            extractAll(images, extractor, loaded.entries(), store, skipped, counters);

            if (cache != null) {
                if (!store.isEmpty()) {
                    cache.saveAll(store.records());
                }
                cache.pruneMissing();
            }

            List<DuplicateGroup> groups = List.of();
            if (cancelled.get()) {
                log.warn("執行已取消，略過分群。已完成 {} 張圖片的指紋。", store.size());
            } else {
                groups = groupRecords(store);
            }

            Map<String, Fingerprint> fingerprints = new LinkedHashMap<>();
            for (ImageRecord record : store.records()) {
                fingerprints.put(record.identifier(), record.fingerprint());
            }

            log.info("處理結果 -> 總計: {}, 取得指紋: {} (沿用快取 {}), 略過: {}",
                    images.size(), store.size(), counters.getOrDefault(ScanResult.CACHE_HIT, 0), skipped.size());

            return new DedupReport(
                    params.threshold(),
                    extractor.bitLength(),
                    groups,
                    fingerprints,
                    skipped,
                    loaded.warnings(),
                    images.size(),
                    counters.getOrDefault(ScanResult.CACHE_HIT, 0),
                    cancelled.get());
        } finally {
            if (cache != null) {
                cache.close();
            }
        }
    }

    private void extractAll(List<Path> images, HashExtractor extractor, Map<String, CachedFingerprint> cached,
                            FingerprintStore store, List<SkipWarning> skipped, Map<ScanResult, Integer> counters) {
        int threads = params.threads();
        log.info("建立固定大小為 {} 的執行緒池。", threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<String> identifiers = new ArrayList<>(images.size());
            List<Future<ExtractionOutcome>> futures = new ArrayList<>(images.size());
            for (Path path : images) {
                String identifier = path.toString();
                identifiers.add(identifier);
                futures.add(executor.submit(() -> processImage(path, identifier, extractor, cached)));
            }
            log.info("所有任務已提交，等待處理完成...");
            executor.shutdown();

            long deadline = System.nanoTime() + TimeUnit.HOURS.toNanos(timeOutHr);
            int merged = 0;
            for (; merged < futures.size(); merged++) {
                if (cancelled.get()) {
                    break;
                }
                int i = merged;
                Future<ExtractionOutcome> future = futures.get(i);
                String identifier = identifiers.get(i);

                ExtractionOutcome outcome;
                try {
                    outcome = future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.warn("{} - 超過執行時間上限 {} 小時，放棄此圖片", identifier, timeOutHr);
                    outcome = ExtractionOutcome.failed(identifier, ScanResult.FAILED_TIMEOUT, "超過執行時間上限");
                } catch (ExecutionException e) {
                    log.error("{} - 處理檔案時發生未知錯誤", identifier, e.getCause());
                    outcome = ExtractionOutcome.failed(identifier, ScanResult.FAILED_UNKNOWN, String.valueOf(e.getCause()));
                } catch (InterruptedException e) {
                    log.error("等待指紋計算時被中斷。", e);
                    Thread.currentThread().interrupt(); // 恢復中斷狀態
                    cancel();
                    break;
                }

                counters.merge(outcome.result(), 1, Integer::sum);
                if (outcome.result().isSuccess()) {
                    store.insert(outcome.identifier(), outcome.fingerprint(), outcome.metadata());
                } else {
                    skipped.add(new SkipWarning(outcome.identifier(), outcome.result(), outcome.reason()));
                }
            }

            // 取消後尚未合併的圖片，不論是否已算完，一律記為略過
            for (int i = merged; i < futures.size(); i++) {
                futures.get(i).cancel(true);
                counters.merge(ScanResult.SKIPPED_CANCELLED, 1, Integer::sum);
                skipped.add(new SkipWarning(identifiers.get(i), ScanResult.SKIPPED_CANCELLED, "執行已取消，結果未採用"));
            }
            if (merged < futures.size()) {
                log.warn("執行已取消，{} 張圖片未處理或結果未採用。", futures.size() - merged);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private ExtractionOutcome processImage(Path path, String identifier, HashExtractor extractor,
                                           Map<String, CachedFingerprint> cached) {
        if (cancelled.get()) {
            return ExtractionOutcome.abandoned(identifier);
        }

        ImageMetadata metadata;
        try {
            if (!Files.exists(path) || !Files.isReadable(path)) {
                log.warn("{} - 檔案不存在或不可讀，跳過", path);
                return ExtractionOutcome.failed(identifier, ScanResult.SKIPPED_NOT_FOUND, "檔案不存在或不可讀");
            }
            metadata = new ImageMetadata(Files.size(path), Files.getLastModifiedTime(path).toMillis());
        } catch (IOException e) {
            log.warn("{} - 無法讀取檔案資訊", path, e);
            return ExtractionOutcome.failed(identifier, ScanResult.FAILED_IO_ERROR, String.valueOf(e.getMessage()));
        }

        CachedFingerprint hit = cached.get(identifier);
        if (hit != null && hit.matches(metadata)) {
            log.debug("{} - 沿用快取指紋", path);
            return ExtractionOutcome.success(identifier, ScanResult.CACHE_HIT, hit.fingerprint(), metadata);
        }

        try {
            PixelGrid grid = imageDecoder.decode(path);
            Fingerprint fingerprint = extractor.extract(grid);
            log.debug("{} - 指紋 {} ({})", path, fingerprint.toHex(), FileTools.formatFileSize(metadata.fileSize()));
            return ExtractionOutcome.success(identifier, ScanResult.FINGERPRINTED, fingerprint, metadata);
        } catch (DecodeException e) {
            log.warn("{} - 無法解碼，跳過: {}", path, e.getReason());
            return ExtractionOutcome.failed(identifier, ScanResult.FAILED_DECODE, e.getReason());
        } catch (OutOfMemoryError e) {
            // 儘管已經做了二次取樣，極端情況下仍可能發生。
            log.error("{} - 處理檔案時發生記憶體溢位錯誤 (圖片可能過大或格式有問題)", path, e);
            return ExtractionOutcome.failed(identifier, ScanResult.FAILED_OUT_OF_MEMORY, "記憶體溢位");
        } catch (RuntimeException e) {
            log.error("{} - 處理檔案時發生未知錯誤", path, e);
            return ExtractionOutcome.failed(identifier, ScanResult.FAILED_UNKNOWN, String.valueOf(e));
        }
    }

    private List<DuplicateGroup> groupRecords(FingerprintStore store) {
        if (store.isEmpty()) {
            return List.of();
        }
        SimilarityIndex index = params.indexType().create(store.records().get(0).fingerprint().bitLength(), params.threshold());
        index.build(store.records());
        log.info("相似度索引已建立，共 {} 筆指紋。", index.size());

        List<DuplicateGroup> groups = new DuplicateGrouper().group(store, index, params.threshold());
        long duplicates = groups.stream().filter(DuplicateGroup::isDuplicate).count();
        log.info("分群完成：{} 個群組，其中 {} 組為重複圖片。", groups.size(), duplicates);
        return groups;
    }
}
