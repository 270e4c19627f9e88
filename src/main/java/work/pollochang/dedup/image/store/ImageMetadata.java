package work.pollochang.dedup.image.store;

/**
 * 圖片的附加資訊，用於判斷快取是否仍然有效。
 *
 * @param fileSize           檔案大小 (bytes)，未知時為 -1
 * @param lastModifiedMillis 最後修改時間 (epoch millis)，未知時為 -1
 */
public record ImageMetadata(long fileSize, long lastModifiedMillis) {

    public static final ImageMetadata UNKNOWN = new ImageMetadata(-1, -1);

    public boolean isKnown() {
        return fileSize >= 0 && lastModifiedMillis >= 0;
    }
}
