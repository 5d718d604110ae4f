package org.filest.filesystem.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 分片上传初始化请求。
 *
 * @param path        目标目录（相对沙箱根；为空表示根目录）
 * @param filename    目标文件名（只能是文件名，不能包含路径分隔符）
 * @param totalSize   文件总大小（字节）
 * @param chunkSize   分片大小（字节）
 * @param totalChunks 分片数量
 *
 * <p>数值字段必须显式给出，缺省不会当作 0 处理。</p>
 */
public record ChunkedInitRequest(
        String path,
        @NotBlank String filename,
        @NotNull @Min(0) Long totalSize,
        @NotNull @Min(1) Long chunkSize,
        @NotNull @Min(0) Integer totalChunks
) {
}
