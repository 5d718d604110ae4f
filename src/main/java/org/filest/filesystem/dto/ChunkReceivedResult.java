package org.filest.filesystem.dto;

/**
 * 单个分片的接收确认。
 *
 * @param chunkIndex 分片下标
 * @param received   恒为 true
 */
public record ChunkReceivedResult(
        int chunkIndex,
        boolean received
) {
}
