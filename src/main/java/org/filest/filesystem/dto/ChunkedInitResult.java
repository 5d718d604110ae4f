package org.filest.filesystem.dto;

/**
 * 分片上传初始化结果。
 *
 * @param uploadId  会话 id，后续 chunk/complete/abort 都要带上
 * @param chunkSize 服务端确认的分片大小（即客户端声明的值）
 */
public record ChunkedInitResult(
        String uploadId,
        long chunkSize
) {
}
