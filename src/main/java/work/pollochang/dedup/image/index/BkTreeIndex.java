package work.pollochang.dedup.image.index;

import work.pollochang.dedup.image.core.Fingerprint;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 以漢明距離為度量的 BK 樹。
 * <p>
 * 每個子節點以「與父節點的距離」為標籤。查詢時若與節點距離為 d，
 * 依三角不等式只需走訪標籤落在 [d - T, d + T] 的子樹。
 * 插入與查詢皆以迴圈實作，不受樹高影響堆疊深度。
 */
public class BkTreeIndex extends AbstractSimilarityIndex {

    private static final class Node {
        final int ordinal;
        final NavigableMap<Integer, Node> children = new TreeMap<>();

        Node(int ordinal) {
            this.ordinal = ordinal;
        }
    }

    private Node root;

    public BkTreeIndex(int bitLength) {
        super(bitLength);
    }

    @Override
    protected void onInsert(int ordinal, Fingerprint fingerprint) {
        Node node = new Node(ordinal);
        if (root == null) {
            root = node;
            return;
        }
        Node current = root;
        while (true) {
            int distance = fingerprintAt(current.ordinal).distance(fingerprint);
            Node child = current.children.get(distance);
            if (child == null) {
                current.children.put(distance, node);
                return;
            }
            current = child;
        }
    }

    @Override
    protected void collect(Fingerprint query, int threshold, List<Neighbor> out) {
        if (root == null) {
            return;
        }
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            int distance = fingerprintAt(node.ordinal).distance(query);
            if (distance <= threshold) {
                out.add(new Neighbor(identifierAt(node.ordinal), distance));
            }
            int high = (int) Math.min((long) distance + threshold, Integer.MAX_VALUE);
            for (Node child : node.children.subMap(distance - threshold, true, high, true).values()) {
                pending.push(child);
            }
        }
    }
}
