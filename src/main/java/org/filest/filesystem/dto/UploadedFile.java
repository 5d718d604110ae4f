package org.filest.filesystem.dto;

/**
 * 已落盘的文件。
 *
 * @param name 文件名
 * @param size 文件大小（字节）
 * @param path 相对沙箱根的逻辑路径（以 / 开头，统一使用 / 分隔）
 */
public record UploadedFile(
        String name,
        long size,
        String path
) {
}
