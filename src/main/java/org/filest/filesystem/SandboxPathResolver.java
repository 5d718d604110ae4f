package org.filest.filesystem;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.regex.Pattern;

/**
 * 沙箱路径解析器：把用户传入的相对路径解析成 {@link SandboxedPath}，并确保它不会逃逸出沙箱根目录。
 * <p>
 * 规则：
 * <ul>
 *   <li>路径分隔符是 {@code /}，另加上当前平台的分隔符（Windows 上的 {@code \}）；
 *   POSIX 上 {@code \} 只是文件名里的普通字符。</li>
 *   <li>去掉开头的分隔符后逐段处理：空段与 {@code .} 忽略，{@code ..} 回退一级；已在根目录时再回退直接拒绝，
 *   即使后续的段能"绕回"根目录也不行。</li>
 *   <li>逻辑路径拼好后再做一次 startsWith 校验，结果必须仍在根目录下。</li>
 *   <li>沿实际路径逐级检查：遇到符号链接/junction 时解析其真实路径，真实路径必须仍在根目录内。
 *   第一个不存在的段之后的部分按字面追加（目标文件可能尚未创建）。</li>
 * </ul>
 * 所有失败都是同一个 {@link ErrorCode#ACCESS_DENIED}，不区分原因，避免被用来探测目录结构。
 * <p>
 * 解析结果每次请求重新计算，不做缓存。
 */
public class SandboxPathResolver {

    private static final String PLATFORM_SEPARATOR = FileSystems.getDefault().getSeparator();

    private static final Pattern SEGMENT_SPLIT = "/".equals(PLATFORM_SEPARATOR)
            ? Pattern.compile("/")
            : Pattern.compile("/|" + Pattern.quote(PLATFORM_SEPARATOR));

    private final Path root;
    private final boolean allowSymlink;

    public SandboxPathResolver(FileServerProperties properties) {
        this(initRoot(Path.of(properties.getRoot())), properties.isAllowSymlink());
    }

    public SandboxPathResolver(Path root, boolean allowSymlink) {
        try {
            this.root = root.toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root, e);
        }
        this.allowSymlink = allowSymlink;
    }

    public Path root() {
        return root;
    }

    public SandboxedPath resolve(String userPath) {
        Path logical = walk(root, userPath);
        // 拼接结果必须仍在根目录下
        if (!logical.startsWith(root)) {
            throw TransferException.accessDenied();
        }
        return new SandboxedPath(root, logical, resolveActual(logical));
    }

    /**
     * 解析"目录 + 文件名"。文件名必须是单独的一段（不能含分隔符，不能是 {@code .}/{@code ..}）。
     */
    public SandboxedPath resolveFile(String directory, String fileName) {
        if (!isPlainFileName(fileName)) {
            throw TransferException.accessDenied();
        }
        Path logical = walk(root, directory);
        if (!logical.startsWith(root)) {
            throw TransferException.accessDenied();
        }
        logical = logical.resolve(fileName);
        return new SandboxedPath(root, logical, resolveActual(logical));
    }

    public static boolean isPlainFileName(String name) {
        if (name == null || name.isBlank() || name.length() > 255) {
            return false;
        }
        if (".".equals(name) || "..".equals(name)) {
            return false;
        }
        return name.indexOf('/') < 0 && !name.contains(PLATFORM_SEPARATOR) && name.indexOf('\0') < 0;
    }

    private static Path walk(Path root, String userPath) {
        String normalized = userPath == null ? "" : stripLeadingSeparators(userPath);
        Path cursor = root;
        for (String component : SEGMENT_SPLIT.split(normalized)) {
            if (component.isEmpty() || ".".equals(component)) {
                continue;
            }
            if ("..".equals(component)) {
                if (cursor.equals(root)) {
                    throw TransferException.accessDenied();
                }
                cursor = cursor.getParent();
                continue;
            }
            try {
                cursor = cursor.resolve(component);
            } catch (InvalidPathException e) {
                throw TransferException.accessDenied();
            }
        }
        return cursor;
    }

    private Path resolveActual(Path logical) {
        Path cursor = root;
        Iterator<Path> segments = root.relativize(logical).iterator();
        while (segments.hasNext()) {
            Path segment = segments.next();
            if (segment.toString().isEmpty()) {
                continue;
            }
            Path candidate = cursor.resolve(segment);
            if (!Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
                // 剩余部分尚不存在，按字面追加
                cursor = candidate;
                while (segments.hasNext()) {
                    cursor = cursor.resolve(segments.next());
                }
                return cursor;
            }
            if (Files.isSymbolicLink(candidate)) {
                if (!allowSymlink) {
                    throw TransferException.accessDenied();
                }
                try {
                    candidate = candidate.toRealPath();
                } catch (IOException e) {
                    // 悬空链接：写入会落到链接指向的位置，同样拒绝
                    throw TransferException.accessDenied();
                }
                if (!candidate.startsWith(root)) {
                    throw TransferException.accessDenied();
                }
            }
            cursor = candidate;
        }
        return cursor;
    }

    private static String stripLeadingSeparators(String path) {
        int i = 0;
        while (i < path.length() && isSeparator(path.charAt(i))) {
            i++;
        }
        return path.substring(i);
    }

    private static boolean isSeparator(char c) {
        return c == '/' || PLATFORM_SEPARATOR.indexOf(c) >= 0;
    }

    private static Path initRoot(Path configured) {
        try {
            Files.createDirectories(configured);
        } catch (IOException e) {
            throw new IllegalStateException("无法创建根目录：" + configured, e);
        }
        return configured.toAbsolutePath().normalize();
    }
}
