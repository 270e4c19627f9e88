package work.pollochang.dedup.image.group;

/**
 * 不相交集合 (disjoint-set)，元素為 0..n-1。
 * <p>
 * 依集合大小合併，{@link #find(int)} 以兩趟迴圈做完整路徑壓縮，
 * 不使用遞迴，極長的串鏈也不會耗盡堆疊。
 */
public final class UnionFind {

    private final int[] parent;
    private final int[] size;
    private int components;

    public UnionFind(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("元素數量不可為負: " + n);
        }
        parent = new int[n];
        size = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
            size[i] = 1;
        }
        components = n;
    }

    public int find(int element) {
        int root = element;
        while (parent[root] != root) {
            root = parent[root];
        }
        // 第二趟：路徑上的節點全部直接指向根
        int current = element;
        while (parent[current] != root) {
            int next = parent[current];
            parent[current] = root;
            current = next;
        }
        return root;
    }

    /**
     * @return 原本分屬不同集合時為 true
     */
    public boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (size[rootA] < size[rootB]) {
            int tmp = rootA;
            rootA = rootB;
            rootB = tmp;
        }
        parent[rootB] = rootA;
        size[rootA] += size[rootB];
        components--;
        return true;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    public int setSize(int element) {
        return size[find(element)];
    }

    public int components() {
        return components;
    }

    public int elementCount() {
        return parent.length;
    }
}
