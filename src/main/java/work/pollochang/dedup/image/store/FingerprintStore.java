package work.pollochang.dedup.image.store;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.core.Fingerprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 單次執行期間的指紋倉庫，只能新增不能修改。
 * <p>
 * 保留插入順序，分組時的平手判定依此順序進行，因此相同輸入順序在不同次執行會得到相同結果。
 * 本類別不是執行緒安全的：依設計只由協調執行緒寫入。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class FingerprintStore {

    private final List<ImageRecord> records = new ArrayList<>();
    private final Map<String, Integer> ordinals = new HashMap<>();

    /**
     * 新增一筆紀錄。
     *
     * @return 新建立的紀錄
     * @throws DuplicateIdentifierException 識別字已存在
     * @throws IllegalArgumentException     指紋長度與先前的紀錄不同
     */
    public ImageRecord insert(String identifier, Fingerprint fingerprint, ImageMetadata metadata) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        if (ordinals.containsKey(identifier)) {
            throw new DuplicateIdentifierException(identifier);
        }
        if (!records.isEmpty() && records.get(0).fingerprint().bitLength() != fingerprint.bitLength()) {
            throw new IllegalArgumentException("指紋長度 " + fingerprint.bitLength()
                    + " 與倉庫中的 " + records.get(0).fingerprint().bitLength() + " 不一致: " + identifier);
        }

        ImageRecord record = new ImageRecord(identifier, fingerprint, metadata == null ? ImageMetadata.UNKNOWN : metadata);
        ordinals.put(identifier, records.size());
        records.add(record);
        log.trace("{} - 加入指紋倉庫，序號 {}", identifier, records.size() - 1);
        return record;
    }

    /**
     * @throws RecordNotFoundException 識別字不存在
     */
    public ImageRecord get(String identifier) {
        return records.get(ordinalOf(identifier));
    }

    /**
     * 識別字的插入序號 (從 0 開始)。
     *
     * @throws RecordNotFoundException 識別字不存在
     */
    public int ordinalOf(String identifier) {
        Integer ordinal = ordinals.get(identifier);
        if (ordinal == null) {
            throw new RecordNotFoundException(identifier);
        }
        return ordinal;
    }

    public boolean contains(String identifier) {
        return ordinals.containsKey(identifier);
    }

    /** 依插入順序排列的唯讀檢視 */
    public List<ImageRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
