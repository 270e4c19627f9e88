package work.pollochang.dedup.image.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileToolsTest {

    /**
     * 遞迴列出圖片，依路徑排序，忽略非圖片副檔名
     */
    @Test
    void testListImages_ShouldWalkRecursivelyInSortedOrder(@TempDir Path tempDir) throws IOException {
        Path sub = Files.createDirectories(tempDir.resolve("b-dir"));
        Files.writeString(tempDir.resolve("z.JPG"), "x");
        Files.writeString(tempDir.resolve("a.png"), "x");
        Files.writeString(sub.resolve("c.webp"), "x");
        Files.writeString(tempDir.resolve("readme.md"), "x");
        Files.writeString(tempDir.resolve("noext"), "x");

        List<Path> images = FileTools.listImages(tempDir);

        assertEquals(List.of(tempDir.resolve("a.png"), sub.resolve("c.webp"), tempDir.resolve("z.JPG")), images);
    }

    /**
     * 走訪時遇到無法讀取的項目，記錄後繼續走訪其餘檔案
     */
    @Test
    void testVisitFileFailed_ShouldContinueWalk(@TempDir Path tempDir) {
        FileTools.ImageCollector collector = new FileTools.ImageCollector();
        Path locked = tempDir.resolve("locked");

        FileVisitResult result = collector.visitFileFailed(locked, new AccessDeniedException(locked.toString()));

        assertEquals(FileVisitResult.CONTINUE, result);
        assertTrue(collector.getImages().isEmpty());
    }

    /**
     * 無權限的子目錄不會中斷整體列舉
     */
    @Test
    void testListImagesWithUnreadableSubdirectory_ShouldKeepOtherImages(@TempDir Path tempDir) throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path locked = Files.createDirectories(tempDir.resolve("locked"));
        Files.writeString(locked.resolve("hidden.png"), "x");
        Files.writeString(tempDir.resolve("a.png"), "x");
        Files.writeString(tempDir.resolve("z.jpg"), "x");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            // root 帳號不受權限限制
            assumeFalse(Files.isReadable(locked));

            List<Path> images = FileTools.listImages(tempDir);

            assertEquals(List.of(tempDir.resolve("a.png"), tempDir.resolve("z.jpg")), images);
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    /**
     * 檔案列表保留順序並略過空白行
     */
    @Test
    void testReadFileList_ShouldTrimAndSkipBlankLines(@TempDir Path tempDir) throws IOException {
        Path list = tempDir.resolve("list.txt");
        Files.write(list, List.of("  /data/b.jpg  ", "", "/data/a.jpg", "   "));

        assertEquals(List.of(Paths.get("/data/b.jpg"), Paths.get("/data/a.jpg")), FileTools.readFileList(list));
    }

    @Test
    void testReadMissingFileList_ShouldThrow(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> FileTools.readFileList(tempDir.resolve("missing.txt")));
    }

    @Test
    void testFormatFileSize_ShouldUseBinaryUnits() {
        assertEquals("0 B", FileTools.formatFileSize(0));
        assertEquals("512 B", FileTools.formatFileSize(512));
        assertEquals("1.5 KB", FileTools.formatFileSize(1536));
        assertEquals("2 MB", FileTools.formatFileSize(2L * 1024 * 1024));
    }

    @Test
    void testEnsureDirectoryExists_ShouldCreateNestedDirectories(@TempDir Path tempDir) {
        Path nested = tempDir.resolve("x/y/z");
        FileTools.ensureDirectoryExists(nested);
        assertTrue(Files.isDirectory(nested));
        FileTools.ensureDirectoryExists(nested);
    }
}
