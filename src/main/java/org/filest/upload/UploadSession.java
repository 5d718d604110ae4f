package org.filest.upload;

import org.filest.filesystem.SandboxedPath;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * 分片上传会话。
 * <p>
 * 只在 {@link UploadSessionStore} 内部被修改（{@code mutate} 的原子回调里）；
 * 存储对外返回的都是 {@link #copy()} 出来的快照，调用方拿到后可以放心在锁外做 IO。
 */
public final class UploadSession {

    private final String uploadId;
    private final String fileName;
    private final long totalSize;
    private final long chunkSize;
    private final int totalChunks;
    private final SandboxedPath destination;
    private final Path scratchDir;
    private final BitSet received;
    private final Instant createdAt;
    private Instant lastActivityAt;

    public UploadSession(
            String uploadId,
            String fileName,
            long totalSize,
            long chunkSize,
            int totalChunks,
            SandboxedPath destination,
            Path scratchDir,
            Instant createdAt
    ) {
        this(uploadId, fileName, totalSize, chunkSize, totalChunks, destination, scratchDir,
                new BitSet(totalChunks), createdAt, createdAt);
    }

    private UploadSession(
            String uploadId,
            String fileName,
            long totalSize,
            long chunkSize,
            int totalChunks,
            SandboxedPath destination,
            Path scratchDir,
            BitSet received,
            Instant createdAt,
            Instant lastActivityAt
    ) {
        this.uploadId = uploadId;
        this.fileName = fileName;
        this.totalSize = totalSize;
        this.chunkSize = chunkSize;
        this.totalChunks = totalChunks;
        this.destination = destination;
        this.scratchDir = scratchDir;
        this.received = received;
        this.createdAt = createdAt;
        this.lastActivityAt = lastActivityAt;
    }

    public String uploadId() {
        return uploadId;
    }

    public String fileName() {
        return fileName;
    }

    public long totalSize() {
        return totalSize;
    }

    public long chunkSize() {
        return chunkSize;
    }

    public int totalChunks() {
        return totalChunks;
    }

    /**
     * 目标文件（目录 + 文件名）的沙箱路径。
     */
    public SandboxedPath destination() {
        return destination;
    }

    public Path scratchDir() {
        return scratchDir;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastActivityAt() {
        return lastActivityAt;
    }

    public boolean isReceived(int chunkIndex) {
        return received.get(chunkIndex);
    }

    public int receivedCount() {
        return received.cardinality();
    }

    /**
     * 尚未收到的分片下标，升序。
     */
    public List<Integer> missingChunks() {
        List<Integer> missing = new ArrayList<>();
        for (int i = received.nextClearBit(0); i < totalChunks; i = received.nextClearBit(i + 1)) {
            missing.add(i);
        }
        return missing;
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return lastActivityAt.plus(ttl).isBefore(now);
    }

    void markReceived(int chunkIndex, Instant now) {
        received.set(chunkIndex);
        lastActivityAt = now;
    }

    UploadSession copy() {
        return new UploadSession(uploadId, fileName, totalSize, chunkSize, totalChunks, destination, scratchDir,
                (BitSet) received.clone(), createdAt, lastActivityAt);
    }
}
