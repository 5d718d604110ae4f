package org.filest.ws;

import org.filest.filesystem.SandboxedPath;
import org.filest.filesystem.TransferSink;

/**
 * 单个 WebSocket 连接上的上传会话。只被所属连接的处理线程访问，不做同步。
 */
final class StreamSession {

    private final String uploadId;
    private final SandboxedPath target;
    private final long totalSize;
    private final TransferSink sink;
    private long receivedSize;

    StreamSession(String uploadId, SandboxedPath target, long totalSize, TransferSink sink) {
        this.uploadId = uploadId;
        this.target = target;
        this.totalSize = totalSize;
        this.sink = sink;
    }

    String uploadId() {
        return uploadId;
    }

    SandboxedPath target() {
        return target;
    }

    long totalSize() {
        return totalSize;
    }

    TransferSink sink() {
        return sink;
    }

    long receivedSize() {
        return receivedSize;
    }

    /**
     * 累加已接收字节数，返回累加前的值。
     */
    long addReceived(long length) {
        long previous = receivedSize;
        receivedSize += length;
        return previous;
    }
}
