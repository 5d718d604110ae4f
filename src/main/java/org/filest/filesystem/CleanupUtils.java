package org.filest.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * 清理工具类：删除临时文件 / 暂存目录。
 * <p>
 * 说明：
 * <ul>
 *   <li>清理是建议性的：失败只记 WARN 日志，不向调用方抛异常。</li>
 *   <li>目录删除用 {@link Files#walkFileTree} 迭代完成，不做递归调用，深层目录也不会栈溢出；不跟随符号链接。</li>
 * </ul>
 */
public final class CleanupUtils {

    private static final Logger log = LoggerFactory.getLogger(CleanupUtils.class);

    private CleanupUtils() {
    }

    public static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("清理临时文件失败：{}", file, e);
        }
    }

    public static void deleteTreeQuietly(Path dir) {
        if (dir == null || !Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.deleteIfExists(d);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("清理目录失败：{}", dir, e);
        }
    }
}
