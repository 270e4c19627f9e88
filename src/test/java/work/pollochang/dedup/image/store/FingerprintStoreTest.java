package work.pollochang.dedup.image.store;

import org.junit.jupiter.api.Test;
import work.pollochang.dedup.image.core.Fingerprint;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintStoreTest {

    private static final Fingerprint FP = Fingerprint.fromBinaryString("01010101");

    /**
     * 保留插入順序與序號
     */
    @Test
    void testInsert_ShouldKeepInsertionOrder() {
        FingerprintStore store = new FingerprintStore();
        store.insert("c.jpg", FP, new ImageMetadata(10, 1000));
        store.insert("a.jpg", FP, null);
        store.insert("b.jpg", FP, ImageMetadata.UNKNOWN);

        List<String> ids = store.records().stream().map(ImageRecord::identifier).collect(Collectors.toList());
        assertEquals(List.of("c.jpg", "a.jpg", "b.jpg"), ids);
        assertEquals(1, store.ordinalOf("a.jpg"));
        assertEquals(3, store.size());
        assertFalse(store.get("a.jpg").metadata().isKnown());
        assertTrue(store.get("c.jpg").metadata().isKnown());
    }

    /**
     * 重複的識別字應被拒絕，倉庫內容不變
     */
    @Test
    void testDuplicateIdentifier_ShouldThrow() {
        FingerprintStore store = new FingerprintStore();
        store.insert("a.jpg", FP, null);

        DuplicateIdentifierException e = assertThrows(DuplicateIdentifierException.class,
                () -> store.insert("a.jpg", Fingerprint.fromBinaryString("11111111"), null));
        assertEquals("a.jpg", e.getIdentifier());
        assertEquals(1, store.size());
        assertEquals(FP, store.get("a.jpg").fingerprint());
    }

    /**
     * 查詢不存在的識別字
     */
    @Test
    void testUnknownIdentifier_ShouldThrowRecordNotFound() {
        FingerprintStore store = new FingerprintStore();
        assertTrue(store.isEmpty());
        assertFalse(store.contains("x.jpg"));
        assertThrows(RecordNotFoundException.class, () -> store.get("x.jpg"));
        assertThrows(RecordNotFoundException.class, () -> store.ordinalOf("x.jpg"));
    }

    /**
     * 同一倉庫內的指紋長度必須一致
     */
    @Test
    void testMixedBitLength_ShouldThrow() {
        FingerprintStore store = new FingerprintStore();
        store.insert("a.jpg", FP, null);
        assertThrows(IllegalArgumentException.class,
                () -> store.insert("b.jpg", Fingerprint.fromBinaryString("0101"), null));
    }

    /**
     * 回傳的清單不可修改
     */
    @Test
    void testRecordsView_ShouldBeUnmodifiable() {
        FingerprintStore store = new FingerprintStore();
        store.insert("a.jpg", FP, null);
        assertThrows(UnsupportedOperationException.class, () -> store.records().clear());
    }
}
