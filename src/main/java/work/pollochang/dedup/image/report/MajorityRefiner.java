package work.pollochang.dedup.image.report;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.core.Fingerprint;
import work.pollochang.dedup.image.group.DuplicateGroup;
import work.pollochang.dedup.image.group.SimilarityEdge;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 串鏈群組的選用後處理。
 * <p>
 * 若某成員與群組中超過一半的其他成員距離大於門檻，就把它移出成為單張群組；
 * 每次移出「距離過遠次數」最多的成員 (相同時移出較晚插入者)，重複直到穩定。
 * 只在報表層使用，不影響核心分群結果。
 */
@Slf4j
public class MajorityRefiner {

    private final int threshold;

    public MajorityRefiner(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("距離門檻不可為負: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * 對整份報告的群組做後處理。
     */
    public DedupReport refine(DedupReport report) {
        List<DuplicateGroup> refined = new ArrayList<>();
        for (DuplicateGroup group : report.groups()) {
            refined.addAll(refine(group, report.fingerprints()));
        }
        return report.withGroups(refined);
    }

    /**
     * @return 第一個元素為保留下來的群組，其後為被移出的單張群組 (依原本成員順序)
     */
    public List<DuplicateGroup> refine(DuplicateGroup group, Map<String, Fingerprint> fingerprints) {
        List<String> kept = new ArrayList<>(group.members());
        Set<String> removed = new HashSet<>();

        while (kept.size() > 2) {
            int worst = -1;
            int worstFar = -1;
            for (int i = 0; i < kept.size(); i++) {
                int far = 0;
                Fingerprint fp = fingerprints.get(kept.get(i));
                for (int j = 0; j < kept.size(); j++) {
                    if (i != j && fp.distance(fingerprints.get(kept.get(j))) > threshold) {
                        far++;
                    }
                }
                if (far >= worstFar) {
                    worst = i;
                    worstFar = far;
                }
            }
            if (worstFar * 2 <= kept.size() - 1) {
                break;
            }
            String member = kept.remove(worst);
            removed.add(member);
            log.debug("{} - 與群組中 {} 張圖片距離超過門檻，移出群組", member, worstFar);
        }

        if (removed.isEmpty()) {
            return List.of(group);
        }

        List<SimilarityEdge> keptEdges = group.edges().stream()
                .filter(e -> !removed.contains(e.first()) && !removed.contains(e.second()))
                .collect(Collectors.toList());
        List<DuplicateGroup> out = new ArrayList<>();
        out.add(new DuplicateGroup(kept, keptEdges));
        for (String member : group.members()) {
            if (removed.contains(member)) {
                out.add(new DuplicateGroup(List.of(member), List.of()));
            }
        }
        return out;
    }
}
