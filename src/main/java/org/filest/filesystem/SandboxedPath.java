package org.filest.filesystem;

import java.nio.file.Path;

/**
 * 沙箱内的一条已校验路径。
 *
 * @param root    沙箱根目录（realPath）
 * @param logical 逻辑路径：按用户输入逐段拼接，不跟随符号链接；用于对外展示
 * @param actual  实际路径：链接解析后的真实位置，所有 IO 都作用在它上面；目标不存在且链路上没有链接时与 logical 相同
 */
public record SandboxedPath(Path root, Path logical, Path actual) {

    /**
     * 对外展示的路径：相对沙箱根、以 {@code /} 开头并统一使用 {@code /} 分隔，根目录本身为 {@code /}。
     */
    public String displayPath() {
        String relative = root.relativize(logical).toString().replace('\\', '/');
        return relative.isEmpty() ? "/" : "/" + relative;
    }

    public String fileName() {
        Path name = logical.getFileName();
        return (name == null || logical.equals(root)) ? "" : name.toString();
    }
}
