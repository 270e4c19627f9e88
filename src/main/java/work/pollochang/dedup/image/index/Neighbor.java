package work.pollochang.dedup.image.index;

import java.util.Comparator;

/**
 * 查詢結果：索引中的一筆指紋與查詢指紋的漢明距離。
 */
public record Neighbor(String identifier, int distance) {

    /** 先依距離，再依識別字排序 */
    public static final Comparator<Neighbor> ORDER = Comparator
            .comparingInt(Neighbor::distance)
            .thenComparing(Neighbor::identifier);
}
