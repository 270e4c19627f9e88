package work.pollochang.dedup.image.group;

import java.util.List;

/**
 * 一個重複群組：相似度圖上的一個連通分量。
 * <p>
 * 成員之間經由一條或多條邊串連，不保證兩兩距離都在門檻內 (串鏈分群)。
 *
 * @param members 成員識別字，依插入順序排列，至少一個
 * @param edges   分群時在成員之間找到的邊
 */
public record DuplicateGroup(List<String> members, List<SimilarityEdge> edges) {

    public DuplicateGroup {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("群組至少需要一個成員");
        }
        members = List.copyOf(members);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public int size() {
        return members.size();
    }

    /** 是否包含兩張以上的圖片 */
    public boolean isDuplicate() {
        return members.size() > 1;
    }

    /** 成員指紋完全相同 (所有邊距離皆為 0) */
    public boolean isIdentical() {
        return isDuplicate() && edges.stream().allMatch(e -> e.distance() == 0);
    }

    public int maxEdgeDistance() {
        return edges.stream().mapToInt(SimilarityEdge::distance).max().orElse(0);
    }
}
