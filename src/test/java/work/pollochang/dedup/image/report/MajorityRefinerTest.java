package work.pollochang.dedup.image.report;

import org.junit.jupiter.api.Test;
import work.pollochang.dedup.image.core.Fingerprint;
import work.pollochang.dedup.image.group.DuplicateGroup;
import work.pollochang.dedup.image.group.SimilarityEdge;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MajorityRefinerTest {

    private static Map<String, Fingerprint> fingerprints(String... idAndBits) {
        Map<String, Fingerprint> map = new LinkedHashMap<>();
        for (int i = 0; i < idAndBits.length; i += 2) {
            map.put(idAndBits[i], Fingerprint.fromBinaryString(idAndBits[i + 1]));
        }
        return map;
    }

    private static DuplicateGroup chainGroup() {
        return new DuplicateGroup(List.of("A", "B", "C", "D", "E"), List.of(
                new SimilarityEdge("A", "B", 1),
                new SimilarityEdge("B", "C", 1),
                new SimilarityEdge("C", "D", 1),
                new SimilarityEdge("D", "E", 1)));
    }

    /**
     * 長串鏈的尾端被移出，剩下的核心成員仍彼此接近
     */
    @Test
    void testChainGroup_ShouldDropOutlyingMembers() {
        Map<String, Fingerprint> fps = fingerprints("A", "0000", "B", "0001", "C", "0011", "D", "0111", "E", "1111");

        List<DuplicateGroup> refined = new MajorityRefiner(1).refine(chainGroup(), fps);

        assertEquals(3, refined.size());
        assertEquals(List.of("A", "B", "C"), refined.get(0).members());
        assertEquals(List.of(new SimilarityEdge("A", "B", 1), new SimilarityEdge("B", "C", 1)), refined.get(0).edges());
        assertEquals(List.of("D"), refined.get(1).members());
        assertEquals(List.of("E"), refined.get(2).members());
    }

    /**
     * 成員彼此接近的群組維持不變
     */
    @Test
    void testTightGroup_ShouldStayUnchanged() {
        Map<String, Fingerprint> fps = fingerprints("A", "0000", "B", "0001", "C", "0010");
        DuplicateGroup group = new DuplicateGroup(List.of("A", "B", "C"), List.of(
                new SimilarityEdge("A", "B", 1), new SimilarityEdge("A", "C", 1)));

        assertEquals(List.of(group), new MajorityRefiner(1).refine(group, fps));
    }

    /**
     * 對整份報告處理時，其餘欄位保持不變
     */
    @Test
    void testRefineReport_ShouldOnlyReplaceGroups() {
        Map<String, Fingerprint> fps = fingerprints("A", "0000", "B", "0001", "C", "0011", "D", "0111", "E", "1111", "X", "1010");
        DedupReport report = new DedupReport(1, 4,
                List.of(chainGroup(), new DuplicateGroup(List.of("X"), List.of())),
                fps, List.of(), List.of("warn"), 6, 2, false);

        DedupReport refined = new MajorityRefiner(1).refine(report);

        assertEquals(4, refined.groups().size());
        assertEquals(1, refined.duplicateGroups().size());
        assertEquals(3, refined.duplicateImageCount());
        assertEquals(report.fingerprints(), refined.fingerprints());
        assertEquals(List.of("warn"), refined.cacheWarnings());
        assertEquals(2, refined.cacheHits());
    }

    @Test
    void testNegativeThreshold_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new MajorityRefiner(-1));
    }
}
