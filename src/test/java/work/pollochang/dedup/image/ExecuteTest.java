package work.pollochang.dedup.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 以命令列執行整個流程
 */
class ExecuteTest {

    @TempDir
    Path tempDir;

    private Path imageDir;

    /**
     * 產生水平漸層影像
     */
    private BufferedImage createGradientImage(int width, int height, Color left, Color right) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(new GradientPaint(0, 0, left, width, 0, right));
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    @BeforeEach
    void setUp() throws IOException {
        imageDir = Files.createDirectory(tempDir.resolve("images"));
        BufferedImage gradient = createGradientImage(160, 120, Color.WHITE, Color.BLACK);
        ImageIO.write(gradient, "png", imageDir.resolve("a.png").toFile());
        ImageIO.write(gradient, "png", imageDir.resolve("b.png").toFile());
        ImageIO.write(createGradientImage(160, 120, Color.BLACK, Color.WHITE), "png", imageDir.resolve("c.png").toFile());
        Files.writeString(imageDir.resolve("fake.jpg"), "not really a jpeg");
        Files.writeString(imageDir.resolve("notes.txt"), "ignored");
    }

    private static JsonNode readJson(Path path) throws IOException {
        return new ObjectMapper().readTree(path.toFile());
    }

    /**
     * 掃描目錄：相同的兩張成為一組，偽裝成圖片的檔案被略過
     */
    @Test
    void testScanDirectory_ShouldReportDuplicates() throws IOException {
        Path report = tempDir.resolve("out/report.json");

        int exitCode = Execute.newCommandLine().execute(
                "-d", imageDir.toString(), "--threads", "2", "--report-json", report.toString());

        assertEquals(0, exitCode);
        JsonNode root = readJson(report);
        assertEquals(4, root.get("totalImages").asInt());
        assertEquals(3, root.get("fingerprinted").asInt());
        assertEquals(1, root.get("skippedCount").asInt());
        assertEquals("FAILED_DECODE", root.get("skipped").get(0).get("result").asText());
        assertEquals(4, root.get("threshold").asInt());

        JsonNode groups = root.get("groups");
        assertEquals(1, groups.size());
        assertEquals(imageDir.resolve("a.png").toString(), groups.get(0).get("members").get(0).asText());
        assertEquals(imageDir.resolve("b.png").toString(), groups.get(0).get("members").get(1).asText());
    }

    /**
     * 以檔案列表與相似度百分比執行，第二次執行沿用快取
     */
    @Test
    void testFileListWithCache_ShouldReuseFingerprints() throws IOException {
        Path list = tempDir.resolve("list.txt");
        Files.write(list, List.of(
                imageDir.resolve("a.png").toString(),
                "",
                imageDir.resolve("c.png").toString(),
                imageDir.resolve("b.png").toString()));
        Path cache = tempDir.resolve("cache");
        Path first = tempDir.resolve("first.json");
        Path second = tempDir.resolve("second.json");

        assertEquals(0, Execute.newCommandLine().execute("-f", list.toString(), "-p", "90",
                "--cache-db", cache.toString(), "--report-json", first.toString()));
        assertEquals(0, Execute.newCommandLine().execute("-f", list.toString(), "-p", "90",
                "--cache-db", cache.toString(), "--report-json", second.toString()));

        JsonNode firstRoot = readJson(first);
        JsonNode secondRoot = readJson(second);
        assertEquals(6, firstRoot.get("threshold").asInt());
        assertEquals(0, firstRoot.get("cacheHits").asInt());
        assertEquals(3, secondRoot.get("cacheHits").asInt());
        assertEquals(firstRoot.get("groups"), secondRoot.get("groups"));
        assertEquals(firstRoot.get("fingerprints"), secondRoot.get("fingerprints"));
    }

    /**
     * 其他演算法與索引組合也能完成
     */
    @Test
    void testPhashWithBkTree_ShouldSucceed() throws IOException {
        Path report = tempDir.resolve("phash.json");

        int exitCode = Execute.newCommandLine().execute("-d", imageDir.toString(), "-a", "PHASH",
                "--index", "BK_TREE", "-s", "16", "-t", "10", "--refine", "--show-singletons",
                "--report-json", report.toString());

        assertEquals(0, exitCode);
        JsonNode root = readJson(report);
        assertEquals(256, root.get("bitLength").asInt());
        JsonNode largest = root.get("groups").get(0);
        List<String> members = List.of(largest.get("members").get(0).asText(), largest.get("members").get(1).asText());
        assertTrue(members.contains(imageDir.resolve("a.png").toString()));
        assertTrue(members.contains(imageDir.resolve("b.png").toString()));
    }

    /**
     * 同時指定檔案列表與目錄屬於參數錯誤
     */
    @Test
    void testBothSources_ShouldBeRejected() {
        int exitCode = Execute.newCommandLine().execute("-f", "list.txt", "-d", imageDir.toString());
        assertNotEquals(0, exitCode);
    }

    /**
     * 檔案列表不存在時以結束碼 1 結束
     */
    @Test
    void testMissingFileList_ShouldFail() {
        int exitCode = Execute.newCommandLine().execute("-f", tempDir.resolve("missing.txt").toString());
        assertEquals(1, exitCode);
    }

    /**
     * 相似度為 NaN 時以結束碼 1 結束，不產生報告
     */
    @Test
    void testNaNSimilarity_ShouldFail() {
        Path json = tempDir.resolve("report.json");
        int exitCode = Execute.newCommandLine().execute("-d", imageDir.toString(), "-p", "NaN",
                "--report-json", json.toString());
        assertEquals(1, exitCode);
        assertFalse(Files.exists(json));
    }
}
