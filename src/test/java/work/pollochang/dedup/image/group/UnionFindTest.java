package work.pollochang.dedup.image.group;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnionFindTest {

    @Test
    void testUnion_ShouldMergeSets() {
        UnionFind sets = new UnionFind(5);
        assertEquals(5, sets.components());

        assertTrue(sets.union(0, 1));
        assertTrue(sets.union(3, 4));
        assertFalse(sets.union(1, 0));
        assertTrue(sets.union(1, 4));

        assertTrue(sets.connected(0, 3));
        assertFalse(sets.connected(0, 2));
        assertEquals(4, sets.setSize(3));
        assertEquals(1, sets.setSize(2));
        assertEquals(2, sets.components());
        assertEquals(5, sets.elementCount());
    }

    /**
     * 一百萬個元素串成一條鏈也不會堆疊溢位
     */
    @Test
    void testLongChain_ShouldNotOverflowStack() {
        int n = 1_000_000;
        UnionFind sets = new UnionFind(n);
        for (int i = n - 1; i > 0; i--) {
            sets.union(i, i - 1);
        }
        assertEquals(1, sets.components());
        assertEquals(sets.find(0), sets.find(n - 1));
        assertEquals(n, sets.setSize(n / 2));
    }

    @Test
    void testNegativeSize_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new UnionFind(-1));
        assertEquals(0, new UnionFind(0).components());
    }
}
