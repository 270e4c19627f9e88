package work.pollochang.dedup.image.index;

import work.pollochang.dedup.image.core.Fingerprint;
import work.pollochang.dedup.image.store.DuplicateIdentifierException;
import work.pollochang.dedup.image.store.ImageRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 索引共用的骨架：條目保存、長度檢查、單寫多讀鎖與結果排序。
 * <p>
 * 條目以插入序號 (ordinal) 識別，子類別只需維護自己的查找結構。
 */
abstract class AbstractSimilarityIndex implements SimilarityIndex {

    private final int bitLength;
    private final List<String> identifiers = new ArrayList<>();
    private final List<Fingerprint> fingerprints = new ArrayList<>();
    private final Set<String> known = new HashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    protected AbstractSimilarityIndex(int bitLength) {
        if (bitLength < 1) {
            throw new IllegalArgumentException("指紋長度必須至少 1 位元: " + bitLength);
        }
        this.bitLength = bitLength;
    }

    @Override
    public final void build(Collection<ImageRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        lock.writeLock().lock();
        try {
            if (!identifiers.isEmpty()) {
                throw new IllegalStateException("批次建立只能用於空索引，目前已有 " + identifiers.size() + " 筆");
            }
            // 整批先檢查，任何一筆不合法都不寫入
            Set<String> batch = new HashSet<>();
            for (ImageRecord record : records) {
                Objects.requireNonNull(record, "record must not be null");
                checkLength(record.fingerprint());
                if (!batch.add(record.identifier())) {
                    throw new DuplicateIdentifierException(record.identifier());
                }
            }
            for (ImageRecord record : records) {
                add(record);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public final void insert(ImageRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        lock.writeLock().lock();
        try {
            add(record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void add(ImageRecord record) {
        checkLength(record.fingerprint());
        if (!known.add(record.identifier())) {
            throw new DuplicateIdentifierException(record.identifier());
        }
        int ordinal = identifiers.size();
        identifiers.add(record.identifier());
        fingerprints.add(record.fingerprint());
        onInsert(ordinal, record.fingerprint());
    }

    @Override
    public final List<Neighbor> query(Fingerprint fingerprint, int threshold) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        if (threshold < 0) {
            throw new IllegalArgumentException("距離上限不可為負: " + threshold);
        }
        checkLength(fingerprint);

        List<Neighbor> out = new ArrayList<>();
        lock.readLock().lock();
        try {
            collect(fingerprint, threshold, out);
        } finally {
            lock.readLock().unlock();
        }
        out.sort(Neighbor.ORDER);
        return out;
    }

    @Override
    public final int size() {
        lock.readLock().lock();
        try {
            return identifiers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public final int bitLength() {
        return bitLength;
    }

    /**
     * 新條目已寫入，子類別更新自己的查找結構。呼叫時持有寫鎖。
     */
    protected abstract void onInsert(int ordinal, Fingerprint fingerprint);

    /**
     * 將距離不超過上限的條目加入 {@code out}，每個條目最多一次。呼叫時持有讀鎖。
     */
    protected abstract void collect(Fingerprint query, int threshold, List<Neighbor> out);

    protected final int entryCount() {
        return identifiers.size();
    }

    protected final String identifierAt(int ordinal) {
        return identifiers.get(ordinal);
    }

    protected final Fingerprint fingerprintAt(int ordinal) {
        return fingerprints.get(ordinal);
    }

    /**
     * 精確比較一個條目，符合時加入結果。
     */
    protected final void compare(int ordinal, Fingerprint query, int threshold, List<Neighbor> out) {
        int distance = fingerprints.get(ordinal).distance(query);
        if (distance <= threshold) {
            out.add(new Neighbor(identifiers.get(ordinal), distance));
        }
    }

    private void checkLength(Fingerprint fingerprint) {
        if (fingerprint.bitLength() != bitLength) {
            throw new IllegalArgumentException("指紋長度 " + fingerprint.bitLength() + " 與索引的 " + bitLength + " 不符");
        }
    }
}
