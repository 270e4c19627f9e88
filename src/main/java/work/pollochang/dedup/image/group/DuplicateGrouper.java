package work.pollochang.dedup.image.group;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.index.Neighbor;
import work.pollochang.dedup.image.index.SimilarityIndex;
import work.pollochang.dedup.image.store.FingerprintStore;
import work.pollochang.dedup.image.store.ImageRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 將相似邊收斂成重複群組。
 * <p>
 * 流程：
 * <ol>
 *   <li>每筆紀錄一個集合。</li>
 *   <li>依插入順序逐筆查詢索引中距離不超過門檻的鄰居 (排除自身)，與其合併。</li>
 *   <li>每個根輸出一個群組，成員依插入順序排列，群組依第一個成員的順序排列。</li>
 * </ol>
 * 相似關係不具遞移性，結果是相似度圖的連通分量：A 近 B、B 近 C 時 A、C 會落在同一群，
 * 即使 A 與 C 超過門檻。需要兩兩保證的呼叫端應自行過濾。
 * <p>
 * 固定的插入順序與門檻必定得到相同結果。分群過程不可中途取消。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class DuplicateGrouper {

    /**
     * @param store     指紋倉庫，提供插入順序
     * @param index     已包含倉庫所有紀錄的索引
     * @param threshold 距離門檻 (含)
     * @return 涵蓋所有紀錄的群組 (包含單張群組)
     */
    public List<DuplicateGroup> group(FingerprintStore store, SimilarityIndex index, int threshold) {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(index, "index must not be null");
        if (threshold < 0) {
            throw new IllegalArgumentException("距離門檻不可為負: " + threshold);
        }
        if (index.size() != store.size()) {
            throw new IllegalStateException("索引筆數 " + index.size() + " 與倉庫筆數 " + store.size() + " 不一致");
        }

        List<ImageRecord> records = store.records();
        UnionFind sets = new UnionFind(records.size());
        List<SimilarityEdge> edges = new ArrayList<>();

        for (int ordinal = 0; ordinal < records.size(); ordinal++) {
            ImageRecord record = records.get(ordinal);
            for (Neighbor neighbor : index.query(record.fingerprint(), threshold)) {
                int other = store.ordinalOf(neighbor.identifier());
                if (other == ordinal) {
                    continue;
                }
                // 每條無向邊只由較早插入的一端記錄一次
                if (other > ordinal) {
                    edges.add(new SimilarityEdge(record.identifier(), neighbor.identifier(), neighbor.distance()));
                }
                sets.union(ordinal, other);
            }
        }
        log.debug("找到 {} 條相似邊，合併為 {} 個集合", edges.size(), sets.components());

        Map<Integer, List<String>> membersByRoot = new LinkedHashMap<>();
        for (int ordinal = 0; ordinal < records.size(); ordinal++) {
            membersByRoot.computeIfAbsent(sets.find(ordinal), k -> new ArrayList<>())
                    .add(records.get(ordinal).identifier());
        }

        Map<Integer, List<SimilarityEdge>> edgesByRoot = new LinkedHashMap<>();
        for (SimilarityEdge edge : edges) {
            int root = sets.find(store.ordinalOf(edge.first()));
            edgesByRoot.computeIfAbsent(root, k -> new ArrayList<>()).add(edge);
        }

        List<DuplicateGroup> groups = new ArrayList<>(membersByRoot.size());
        for (Map.Entry<Integer, List<String>> entry : membersByRoot.entrySet()) {
            groups.add(new DuplicateGroup(entry.getValue(), edgesByRoot.getOrDefault(entry.getKey(), List.of())));
        }
        return groups;
    }
}
