package work.pollochang.dedup.image.group;

/**
 * 兩張圖片之間距離不超過門檻的無向邊。{@code first} 為較早插入的一方。
 */
public record SimilarityEdge(String first, String second, int distance) {}
