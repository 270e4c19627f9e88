package work.pollochang.dedup.image.cache;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.core.Fingerprint;
import work.pollochang.dedup.image.store.ImageMetadata;
import work.pollochang.dedup.image.store.ImageRecord;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * H2 指紋快取。
 * <p>
 * 負責所有與 H2 資料庫的底層互動：連線、資料表初始化、檔頭簽章檢查、讀取與批次儲存。
 * 一次執行的生命週期為：開啟 → {@link #loadAll()} 一次 → 執行 → {@link #saveAll(Collection)} 一次
 * → {@link #pruneMissing()} → 關閉。
 * <p>
 * 檔頭 ({@code FINGERPRINT_CACHE_META}) 記錄 {@link CacheSignature}；與目前設定不符時整份快取捨棄並重寫檔頭，
 * 不會把不相容的指紋拿來比較。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class FingerprintCache implements AutoCloseable {

    static final String META_FORMAT_VERSION = "FORMAT_VERSION";
    static final String META_ALGORITHM = "ALGORITHM";
    static final String META_BIT_LENGTH = "BIT_LENGTH";

    private static final String MERGE_ENTRY_SQL = "MERGE INTO FINGERPRINT_CACHE (IMAGE_KEY, FINGERPRINT, FILE_SIZE, LAST_MODIFIED) " +
            "KEY(IMAGE_KEY) VALUES (?, ?, ?, ?)";
    private static final String MERGE_META_SQL = "MERGE INTO FINGERPRINT_CACHE_META (META_KEY, META_VALUE) KEY(META_KEY) VALUES (?, ?)";

    private static final String DELETE_ENTRY_SQL = "DELETE FROM FINGERPRINT_CACHE WHERE IMAGE_KEY = ?";

    private static final int MAX_BATCH_SIZE = 1000;

    private final Connection connection;
    private final CacheSignature signature;

    /**
     * 開啟 (必要時建立) 快取資料庫並確認資料表存在。
     *
     * @param dbPath    H2 資料庫檔案的路徑，可含或不含 .mv.db 副檔名
     * @param signature 目前設定的指紋簽章
     */
    public FingerprintCache(Path dbPath, CacheSignature signature) {
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        // 移除 .mv.db 副檔名 (如果有的話)，因為 JDBC URL 不需要
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        String jdbcUrl = String.format("jdbc:h2:%s", pathStr);
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 指紋快取: {}", dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
        initSchema();
    }

    private void initSchema() {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS FINGERPRINT_CACHE_META (" +
                    "META_KEY VARCHAR(64) PRIMARY KEY, " +
                    "META_VALUE VARCHAR(255) NOT NULL" +
                    ")");
            stmt.execute("CREATE TABLE IF NOT EXISTS FINGERPRINT_CACHE (" +
                    "IMAGE_KEY VARCHAR PRIMARY KEY, " +
                    "FINGERPRINT VARBINARY NOT NULL, " +
                    "FILE_SIZE BIGINT NOT NULL, " +
                    "LAST_MODIFIED BIGINT NOT NULL" +
                    ")");
            log.debug("H2 資料表 'FINGERPRINT_CACHE' 已確認存在。");
        } catch (SQLException e) {
            close();
            throw new RuntimeException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    /**
     * 這份快取接受的指紋簽章。
     */
    public CacheSignature signature() {
        return signature;
    }

    /**
     * 讀取檔頭並載入全部快取紀錄。
     * <ul>
     *   <li>全新的快取：寫入目前的簽章，回傳空結果。</li>
     *   <li>簽章不符：清空快取、重寫簽章，回傳空結果並附上一則警告。</li>
     *   <li>檔頭無法解讀：丟出 {@link CacheCorruptedException}。</li>
     * </ul>
     */
    public CacheLoadResult loadAll() {
        Map<String, String> header = readHeader();

        if (header.isEmpty()) {
            if (countEntries() > 0) {
                throw new CacheCorruptedException("快取中有指紋資料但缺少檔頭，無法判斷格式版本");
            }
            resetTo(signature);
            log.info("建立新的指紋快取，簽章 {}", signature.describe());
            return CacheLoadResult.empty();
        }

        CacheSignature stored = parseHeader(header);
        if (!stored.equals(signature)) {
            String warning = String.format("快取格式 %s 與目前設定 %s 不符，已捨棄整份快取並重新計算所有指紋",
                    stored.describe(), signature.describe());
            log.warn(warning);
            resetTo(signature);
            return new CacheLoadResult(Map.of(), List.of(warning));
        }

        Map<String, CachedFingerprint> entries = new HashMap<>();
        List<String> warnings = new ArrayList<>();
        String selectSql = "SELECT IMAGE_KEY, FINGERPRINT, FILE_SIZE, LAST_MODIFIED FROM FINGERPRINT_CACHE";
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(selectSql)) {
            while (rs.next()) {
                String key = rs.getString("IMAGE_KEY");
                try {
                    Fingerprint fingerprint = Fingerprint.fromBytes(rs.getBytes("FINGERPRINT"), signature.bitLength());
                    ImageMetadata metadata = new ImageMetadata(rs.getLong("FILE_SIZE"), rs.getLong("LAST_MODIFIED"));
                    entries.put(key, new CachedFingerprint(fingerprint, metadata));
                } catch (IllegalArgumentException e) {
                    log.warn("{} - 快取指紋長度不符，略過此筆", key, e);
                }
            }
        } catch (SQLException e) {
            log.error("從 H2 載入快取時發生錯誤", e);
            // 即使載入失敗，也返回空結果，讓程式可以繼續執行
            warnings.add("快取讀取失敗，將重新計算所有指紋: " + e.getMessage());
            return new CacheLoadResult(Map.of(), warnings);
        }
        log.info("從 H2 指紋快取載入 {} 筆紀錄。", entries.size());
        return new CacheLoadResult(entries, warnings);
    }

    /**
     * 將本次執行的紀錄批次寫回快取。沒有檔案資訊的紀錄不寫入。
     */
    public void saveAll(Collection<ImageRecord> records) {
        if (records == null || records.isEmpty()) {
            log.info("沒有需要儲存的指紋紀錄。");
            return;
        }

        for (ImageRecord record : records) {
            if (record.fingerprint().bitLength() != signature.bitLength()) {
                throw new IllegalArgumentException("紀錄的指紋長度與快取簽章不符: " + record.identifier());
            }
        }

        log.info("準備將 {} 筆指紋紀錄批次寫入 H2 快取...", records.size());
        int batchSize = 0;

        try (PreparedStatement ps = connection.prepareStatement(MERGE_ENTRY_SQL)) {
            // 關閉自動提交，手動管理交易
            connection.setAutoCommit(false);

            for (ImageRecord record : records) {
                if (!record.metadata().isKnown()) {
                    continue;
                }
                ps.setString(1, record.identifier());
                ps.setBytes(2, record.fingerprint().toBytes());
                ps.setLong(3, record.metadata().fileSize());
                ps.setLong(4, record.metadata().lastModifiedMillis());
                ps.addBatch();
                batchSize++;

                if (batchSize % MAX_BATCH_SIZE == 0) {
                    ps.executeBatch();
                    log.debug("已提交 {} 筆紀錄至 H2...", batchSize);
                }
            }

            // 執行剩餘的批次
            if (batchSize % MAX_BATCH_SIZE != 0) {
                ps.executeBatch();
            }

            connection.commit();
            log.info("成功將 {} 筆指紋儲存/更新至 H2 快取。", batchSize);

        } catch (SQLException e) {
            log.error("批次儲存快取至 H2 時發生錯誤", e);
            rollbackQuietly();
        } finally {
            restoreAutoCommit();
        }
    }

    /**
     * 刪除對應檔案已不存在的紀錄 (檔案被刪除或改名)，避免快取無限成長。
     * 快取可被多個目錄共用，因此只以檔案是否存在判斷，不以本次是否掃描到判斷。
     *
     * @return 刪除的筆數
     */
    public int pruneMissing() {
        List<String> missing = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT IMAGE_KEY FROM FINGERPRINT_CACHE")) {
            while (rs.next()) {
                String key = rs.getString(1);
                if (isMissing(key)) {
                    missing.add(key);
                }
            }
        } catch (SQLException e) {
            log.error("讀取 H2 快取鍵值時發生錯誤，本次不清理", e);
            return 0;
        }
        if (missing.isEmpty()) {
            return 0;
        }

        int batchSize = 0;
        try (PreparedStatement ps = connection.prepareStatement(DELETE_ENTRY_SQL)) {
            connection.setAutoCommit(false);
            for (String key : missing) {
                ps.setString(1, key);
                ps.addBatch();
                batchSize++;
                if (batchSize % MAX_BATCH_SIZE == 0) {
                    ps.executeBatch();
                }
            }
            if (batchSize % MAX_BATCH_SIZE != 0) {
                ps.executeBatch();
            }
            connection.commit();
            log.info("已從 H2 快取移除 {} 筆檔案已不存在的紀錄。", batchSize);
            return batchSize;
        } catch (SQLException e) {
            log.error("清理 H2 快取時發生錯誤", e);
            rollbackQuietly();
            return 0;
        } finally {
            restoreAutoCommit();
        }
    }

    private static boolean isMissing(String key) {
        try {
            return Files.notExists(Paths.get(key));
        } catch (InvalidPathException e) {
            return true;
        }
    }

    /**
     * 快取中的指紋筆數。
     */
    public int countEntries() {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM FINGERPRINT_CACHE")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("無法讀取 H2 快取筆數", e);
        }
    }

    private Map<String, String> readHeader() {
        Map<String, String> header = new HashMap<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT META_KEY, META_VALUE FROM FINGERPRINT_CACHE_META")) {
            while (rs.next()) {
                header.put(rs.getString(1), rs.getString(2));
            }
        } catch (SQLException e) {
            throw new CacheCorruptedException("無法讀取快取檔頭", e);
        }
        return header;
    }

    private static CacheSignature parseHeader(Map<String, String> header) {
        String version = header.get(META_FORMAT_VERSION);
        String algorithm = header.get(META_ALGORITHM);
        String bitLength = header.get(META_BIT_LENGTH);
        if (version == null || algorithm == null || bitLength == null) {
            throw new CacheCorruptedException("快取檔頭缺少必要欄位: " + header.keySet());
        }
        try {
            return new CacheSignature(Integer.parseInt(version.trim()), algorithm.trim(), Integer.parseInt(bitLength.trim()));
        } catch (NumberFormatException e) {
            throw new CacheCorruptedException("快取檔頭欄位不是數字: " + header, e);
        }
    }

    /**
     * 清空所有指紋並寫入新的簽章，於同一個交易內完成。
     */
    private void resetTo(CacheSignature target) {
        try {
            connection.setAutoCommit(false);
            try (Statement stmt = connection.createStatement()) {
                stmt.executeUpdate("DELETE FROM FINGERPRINT_CACHE");
                stmt.executeUpdate("DELETE FROM FINGERPRINT_CACHE_META");
            }
            try (PreparedStatement ps = connection.prepareStatement(MERGE_META_SQL)) {
                putMeta(ps, META_FORMAT_VERSION, String.valueOf(target.formatVersion()));
                putMeta(ps, META_ALGORITHM, target.algorithm());
                putMeta(ps, META_BIT_LENGTH, String.valueOf(target.bitLength()));
                ps.executeBatch();
            }
            connection.commit();
        } catch (SQLException e) {
            rollbackQuietly();
            throw new RuntimeException("無法重寫 H2 快取檔頭", e);
        } finally {
            restoreAutoCommit();
        }
    }

    private static void putMeta(PreparedStatement ps, String key, String value) throws SQLException {
        ps.setString(1, key);
        ps.setString(2, value);
        ps.addBatch();
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
            log.warn("H2 交易已回滾。");
        } catch (SQLException ex) {
            log.error("回滾 H2 交易失敗", ex);
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.error("無法恢復 H2 連線的自動提交模式", e);
        }
    }

    /**
     * 關閉資料庫連線，釋放資源。
     */
    @Override
    public void close() {
        try {
            if (!connection.isClosed()) {
                log.debug("正在關閉 H2 資料庫連線...");
                connection.close();
                log.info("H2 指紋快取連線已關閉。");
            }
        } catch (SQLException e) {
            log.error("關閉 H2 資料庫連線時發生錯誤。", e);
        }
    }
}
