package com.face.matching.sink;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 清理输出根目录下过期的任务目录
 */
@Slf4j
public class OutputCleaner {

    public static int cleanupOlderThan(Path root, Duration maxAge) {
        return cleanupOlderThan(root, maxAge, dir -> false);
    }

    /**
     * 删除修改时间早于maxAge的子目录
     *
     * @param inUse 返回true的目录不删除（如仍在运行的任务）
     * @return 删除的目录数
     */
    public static int cleanupOlderThan(Path root, Duration maxAge, Predicate<Path> inUse) {
        return cleanupOlderThan(root, maxAge, inUse, dir -> { });
    }

    /**
     * 同上，每删除一个目录回调一次onRemoved
     */
    public static int cleanupOlderThan(Path root, Duration maxAge, Predicate<Path> inUse,
                                       Consumer<Path> onRemoved) {
        if (root == null || !Files.isDirectory(root)) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(maxAge);
        List<Path> candidates = new ArrayList<>();
        try (Stream<Path> stream = Files.list(root)) {
            stream.filter(Files::isDirectory).forEach(candidates::add);
        } catch (IOException e) {
            log.error("Failed to list output root: {}", root, e);
            return 0;
        }

        int removed = 0;
        for (Path dir : candidates) {
            try {
                if (!inUse.test(dir) && Files.getLastModifiedTime(dir).toInstant().isBefore(cutoff)) {
                    deleteRecursively(dir);
                    removed++;
                    log.debug("Expired output directory removed: {}", dir);
                    onRemoved.accept(dir);
                }
            } catch (IOException e) {
                // 可能仍在使用，下次再清理
                log.warn("Failed to remove output directory {}: {}", dir, e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("Removed {} expired output directories under {}", removed, root);
        }
        return removed;
    }

    private static void deleteRecursively(Path dir) throws IOException {
        Files.walkFileTree(dir, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
