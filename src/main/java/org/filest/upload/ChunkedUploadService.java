package org.filest.upload;

import org.filest.filesystem.CleanupUtils;
import org.filest.filesystem.ErrorCode;
import org.filest.filesystem.FileServerProperties;
import org.filest.filesystem.MissingChunksException;
import org.filest.filesystem.SandboxPathResolver;
import org.filest.filesystem.SandboxedPath;
import org.filest.filesystem.TransferException;
import org.filest.filesystem.TransferSink;
import org.filest.filesystem.dto.ChunkReceivedResult;
import org.filest.filesystem.dto.ChunkedInitResult;
import org.filest.filesystem.dto.UploadedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 分片上传协议（REST）：init -> 任意顺序上传分片 -> complete（按下标顺序合并）或 abort。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@link #init}：解析目标路径，生成 uploadId（随机 UUID），在暂存目录下建立该会话私有的子目录。</li>
 *   <li>{@link #putChunk}：分片写入 {@code chunk_00000001} 这类定宽命名的文件，重复上传同一下标直接覆盖。</li>
 *   <li>{@link #complete}：先把会话从存储中移除（并发的第二次 complete 只会看到 SESSION_NOT_FOUND），
 *   缺分片时放回会话并报告缺失下标；否则按 0..N-1 顺序合并到目标目录下的临时文件，fsync 后移动到位。</li>
 *   <li>{@link #abort}：幂等，会话不存在也算成功。</li>
 * </ol>
 * <p>
 * 失败处理：缺分片会放回会话以便补传；合并过程中的 IO 失败不放回会话，
 * 暂存目录保留原样，由后台清理任务按 TTL 回收，客户端需要重新 init。
 * <p>
 * 孤立暂存目录的回收与 init / complete 互斥（{@code scratchLock}）：complete 期间会话暂时不在存储中，
 * 它的暂存目录不能被当成孤立目录删掉。
 */
public class ChunkedUploadService {

    private static final Logger log = LoggerFactory.getLogger(ChunkedUploadService.class);

    /**
     * 分片文件名：定宽补零，目录列表顺序即分片顺序，便于排查。
     */
    private static final String CHUNK_FILE_FORMAT = "chunk_%08d";

    private final SandboxPathResolver pathResolver;
    private final UploadSessionStore sessionStore;
    private final Path scratchBase;
    private final Duration sessionTtl;
    private final int maxChunks;
    private final boolean overwrite;
    private final int bufferSize;
    private final Clock clock;

    /**
     * init / complete 持读锁，孤立目录回收持写锁。
     */
    private final ReadWriteLock scratchLock = new ReentrantReadWriteLock();

    public ChunkedUploadService(
            SandboxPathResolver pathResolver,
            UploadSessionStore sessionStore,
            FileServerProperties properties,
            Clock clock
    ) {
        this.pathResolver = pathResolver;
        this.sessionStore = sessionStore;
        this.scratchBase = properties.getScratchDir().toAbsolutePath().normalize();
        this.sessionTtl = properties.getChunkSessionTtl();
        this.maxChunks = properties.getChunkMaxCount();
        this.overwrite = properties.isOverwriteExisting();
        this.bufferSize = (int) Math.min(Integer.MAX_VALUE, properties.getWriteBufferSize().toBytes());
        this.clock = clock;
    }

    public ChunkedInitResult init(String path, String fileName, long totalSize, long chunkSize, int totalChunks) {
        if (totalSize < 0 || chunkSize < 1) {
            throw new TransferException(ErrorCode.PROTOCOL_ERROR, "参数错误：totalSize 不能为负，chunkSize 必须大于 0");
        }
        if (totalChunks < 0 || totalChunks > maxChunks) {
            throw new TransferException(ErrorCode.PROTOCOL_ERROR,
                    "参数错误：totalChunks 超出范围（0 ~ " + maxChunks + "）：" + totalChunks);
        }
        SandboxedPath destination = pathResolver.resolveFile(path, fileName);

        String uploadId = UUID.randomUUID().toString();
        Path scratchDir = scratchBase.resolve(uploadId);
        scratchLock.readLock().lock();
        try {
            try {
                Files.createDirectories(scratchBase);
                // createDirectory 在目录已存在时失败，保证不会与其他会话共用暂存目录
                Files.createDirectory(scratchDir);
            } catch (IOException e) {
                throw TransferException.ioFailure("创建分片暂存目录失败", e);
            }

            sessionStore.create(new UploadSession(
                    uploadId,
                    destination.fileName(),
                    totalSize,
                    chunkSize,
                    totalChunks,
                    destination,
                    scratchDir,
                    clock.instant()
            ));
        } finally {
            scratchLock.readLock().unlock();
        }
        log.info("分片上传会话已创建：{} -> {}（{} 字节，{} 个分片）",
                uploadId, destination.displayPath(), totalSize, totalChunks);
        return new ChunkedInitResult(uploadId, chunkSize);
    }

    public ChunkReceivedResult putChunk(String uploadId, int chunkIndex, InputStream body) {
        UploadSession session = sessionStore.get(uploadId)
                .orElseThrow(() -> TransferException.sessionNotFound(uploadId));
        if (chunkIndex < 0 || chunkIndex >= session.totalChunks()) {
            throw new TransferException(ErrorCode.INVALID_INDEX,
                    "分片下标越界：" + chunkIndex + "（共 " + session.totalChunks() + " 个分片）");
        }

        // 先写到独立的 .part 文件再移动到位：同一下标并发重复上传时，最终文件总是某一次完整的内容
        Path chunkFile = chunkFile(session.scratchDir(), chunkIndex);
        Path partFile = session.scratchDir().resolve(chunkFile.getFileName() + "." + UUID.randomUUID() + ".part");
        TransferSink sink = null;
        try {
            sink = TransferSink.create(partFile, bufferSize);
            sink.transferFrom(body);
            sink.commit(chunkFile, true);
        } catch (IOException e) {
            if (sink != null) {
                sink.abandon();
            }
            if (!sessionStore.contains(uploadId)) {
                // 写入期间会话被 abort/complete/回收，暂存目录可能已经被删掉
                throw TransferException.sessionNotFound(uploadId);
            }
            throw TransferException.ioFailure("写入分片失败：" + chunkIndex, e);
        }

        Instant now = clock.instant();
        sessionStore.mutate(uploadId, s -> s.markReceived(chunkIndex, now))
                .orElseThrow(() -> TransferException.sessionNotFound(uploadId));
        return new ChunkReceivedResult(chunkIndex, true);
    }

    public UploadedFile complete(String uploadId) {
        scratchLock.readLock().lock();
        try {
            return merge(uploadId);
        } finally {
            scratchLock.readLock().unlock();
        }
    }

    private UploadedFile merge(String uploadId) {
        UploadSession session = sessionStore.remove(uploadId)
                .orElseThrow(() -> TransferException.sessionNotFound(uploadId));

        List<Integer> missing = session.missingChunks();
        if (!missing.isEmpty()) {
            sessionStore.restore(session);
            throw new MissingChunksException(missing);
        }

        // 重新做一次路径解析（init 之后目录里的链接可能发生了变化），确保仍在沙箱内
        SandboxedPath destination;
        try {
            destination = pathResolver.resolve(session.destination().displayPath());
        } catch (TransferException e) {
            abandonSession(session);
            throw e;
        }
        Path target = destination.actual();
        Path directory = target.getParent();

        if (!overwrite && Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            sessionStore.restore(session);
            throw new TransferException(ErrorCode.ALREADY_EXISTS, "目标文件已存在：" + destination.displayPath());
        }

        long size;
        TransferSink sink = null;
        try {
            Files.createDirectories(directory);
            sink = TransferSink.create(directory.resolve(".upload_" + uploadId + ".tmp"), bufferSize);
            // 合并顺序是分片下标顺序，与到达顺序无关
            for (int i = 0; i < session.totalChunks(); i++) {
                try (InputStream in = Files.newInputStream(chunkFile(session.scratchDir(), i))) {
                    sink.transferFrom(in);
                }
            }
            size = sink.bytesWritten();
            sink.commit(target, overwrite);
        } catch (FileAlreadyExistsException e) {
            if (sink == null) {
                // 目标目录路径被一个普通文件占用
                throw TransferException.ioFailure("目标目录无效：" + destination.displayPath(), e);
            }
            sink.abandon();
            sessionStore.restore(session);
            throw new TransferException(ErrorCode.ALREADY_EXISTS, "目标文件已存在：" + destination.displayPath(), e);
        } catch (IOException e) {
            if (sink != null) {
                sink.abandon();
            }
            log.error("合并分片失败：{} -> {}", uploadId, destination.displayPath(), e);
            throw TransferException.ioFailure("合并分片失败：" + destination.displayPath(), e);
        }

        if (size != session.totalSize()) {
            log.warn("合并后的大小与声明不一致：{}，声明 {} 字节，实际 {} 字节", uploadId, session.totalSize(), size);
        }
        CleanupUtils.deleteTreeQuietly(session.scratchDir());
        log.info("分片上传完成：{} -> {}（{} 字节）", uploadId, destination.displayPath(), size);
        return new UploadedFile(session.fileName(), size, destination.displayPath());
    }

    /**
     * 放弃上传。会话不存在时什么也不做。
     */
    public void abort(String uploadId) {
        sessionStore.remove(uploadId).ifPresent(session -> {
            abandonSession(session);
            log.info("分片上传已取消：{}", uploadId);
        });
    }

    /**
     * 回收过期会话，以及没有对应会话且超过 TTL 的暂存目录（例如合并失败后遗留的目录）。
     *
     * @return 回收的会话数 + 目录数
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int reclaimed = 0;
        for (UploadSession session : sessionStore.removeExpired(now, sessionTtl)) {
            abandonSession(session);
            log.info("分片上传会话已过期回收：{}（已收到 {}/{} 个分片）",
                    session.uploadId(), session.receivedCount(), session.totalChunks());
            reclaimed++;
        }
        reclaimed += sweepOrphanScratchDirs(now);
        return reclaimed;
    }

    /**
     * 停机时调用：内存中的会话无法跨进程恢复，直接清掉所有暂存目录。
     */
    public void shutdown() {
        List<UploadSession> remaining = sessionStore.removeAll();
        for (UploadSession session : remaining) {
            abandonSession(session);
        }
        if (!remaining.isEmpty()) {
            log.info("停机清理未完成的分片上传会话：{} 个", remaining.size());
        }
    }

    private int sweepOrphanScratchDirs(Instant now) {
        if (!Files.isDirectory(scratchBase)) {
            return 0;
        }
        if (!scratchLock.writeLock().tryLock()) {
            // 有 init / complete 正在进行，本轮跳过
            log.debug("分片上传进行中，跳过孤立暂存目录回收");
            return 0;
        }
        try {
            return sweepOrphanScratchDirsLocked(now);
        } finally {
            scratchLock.writeLock().unlock();
        }
    }

    private int sweepOrphanScratchDirsLocked(Instant now) {
        Set<String> active = sessionStore.uploadIds();
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(scratchBase)) {
            for (Path dir : stream) {
                String name = dir.getFileName().toString();
                if (active.contains(name) || !Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                Instant modified = Files.getLastModifiedTime(dir, LinkOption.NOFOLLOW_LINKS).toInstant();
                if (modified.plus(sessionTtl).isBefore(now)) {
                    CleanupUtils.deleteTreeQuietly(dir);
                    log.info("回收孤立的分片暂存目录：{}", dir);
                    removed++;
                }
            }
        } catch (IOException e) {
            log.warn("扫描分片暂存目录失败：{}", scratchBase, e);
        }
        return removed;
    }

    private void abandonSession(UploadSession session) {
        CleanupUtils.deleteTreeQuietly(session.scratchDir());
    }

    static Path chunkFile(Path scratchDir, int chunkIndex) {
        return scratchDir.resolve(String.format(CHUNK_FILE_FORMAT, chunkIndex));
    }
}
