package work.pollochang.dedup.image.index;

import work.pollochang.dedup.image.core.Fingerprint;
import work.pollochang.dedup.image.store.ImageRecord;

import java.util.Collection;
import java.util.List;

/**
 * 回答「哪些已索引的指紋與查詢指紋的漢明距離不超過 T」。
 * <p>
 * 所有實作都必須精確計算距離且不可遺漏 (no false negatives)，
 * 結果依 {@link Neighbor#ORDER} 排序。索引只保存識別字與不可變的指紋值，
 * 不持有也不修改 {@link ImageRecord}。
 */
public interface SimilarityIndex {

    /**
     * 批次建立索引，只能在空索引上呼叫一次。任何一筆不合法時整批都不寫入。
     *
     * @throws IllegalStateException 索引已有資料
     * @throws work.pollochang.dedup.image.store.DuplicateIdentifierException 批次內識別碼重複
     * @throws IllegalArgumentException 指紋長度與索引不符
     */
    void build(Collection<ImageRecord> records);

    /**
     * 增量加入一筆紀錄。
     */
    void insert(ImageRecord record);

    /**
     * @param fingerprint 查詢指紋，長度必須與索引一致
     * @param threshold   距離上限 (含)，不可為負
     * @return 距離不超過上限的所有紀錄
     */
    List<Neighbor> query(Fingerprint fingerprint, int threshold);

    int size();

    int bitLength();
}
