package work.pollochang.dedup.image.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
public class FileTools {

    /** 視為圖片的副檔名 */
    public static final Set<String> IMAGE_EXTENSIONS = Set.of(
            ".jpg", ".jpeg", ".jpe", ".jfif", ".png", ".gif", ".bmp", ".pgm", ".pbm", ".ppm", ".webp");

    /**
     * 確保指定的目錄存在，如果不存在則建立它。
     * @param directoryPath 要檢查或建立的目錄路徑
     */
    public static void ensureDirectoryExists(Path directoryPath) {
        if (!Files.exists(directoryPath)) {
            try {
                Files.createDirectories(directoryPath);
                log.info("{} - 目標目錄已建立", directoryPath);
            } catch (IOException e) {
                // 拋出 RuntimeException 使上層能夠捕獲並中止程式
                throw new RuntimeException("無法建立目錄: " + directoryPath, e);
            }
        } else {
            log.debug("{} - 目標目錄已存在", directoryPath);
        }
    }

    public static String formatFileSize(long size) {
        if (size <= 0) return "0 B";
        final String[] units = new String[]{"B", "KB", "MB", "GB", "TB"};
        int digitGroups = (int) (Math.log10(size) / Math.log10(1024));
        return new DecimalFormat("#,##0.#", DecimalFormatSymbols.getInstance(Locale.ROOT)).format(size / Math.pow(1024, digitGroups)) + " " + units[digitGroups];
    }

    /**
     * 逐行讀取圖片路徑列表，忽略空白行，保留原始順序。
     * @param listFile 每行一個路徑的文字檔
     * @return 路徑列表
     */
    public static List<Path> readFileList(Path listFile) throws IOException {
        try (Stream<String> lines = Files.lines(listFile)) {
            return lines.map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(Paths::get)
                    .collect(Collectors.toList());
        }
    }

    /**
     * 遞迴列出目錄下所有圖片，依路徑字典順序排列，使每次執行的插入順序一致。
     * 無法讀取的子目錄或檔案只記錄警告並略過。
     * @param root 起始目錄
     * @return 圖片路徑列表
     */
    public static List<Path> listImages(Path root) throws IOException {
        ImageCollector collector = new ImageCollector();
        Files.walkFileTree(root, collector);
        List<Path> images = collector.getImages();
        Collections.sort(images);
        return images;
    }

    /**
     * 收集圖片路徑的走訪器
     */
    static class ImageCollector extends SimpleFileVisitor<Path> {

        private final List<Path> images = new ArrayList<>();

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && looksLikeImage(file)) {
                images.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.warn("{} - 無法讀取，略過: {}", file, exc.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                log.warn("{} - 目錄走訪中斷，略過其餘內容: {}", dir, exc.toString());
            }
            return FileVisitResult.CONTINUE;
        }

        List<Path> getImages() {
            return images;
        }
    }

    public static boolean looksLikeImage(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && IMAGE_EXTENSIONS.contains(name.substring(dot));
    }
}
