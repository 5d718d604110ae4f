package org.filest.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * 上传落盘的底层写入通道：带缓冲地追加写入一个临时文件，最终 flush + fsync 后移动到目标位置。
 * <p>
 * 约定：
 * <ul>
 *   <li>临时文件由创建本对象的组件独占；分片上传与 WebSocket 上传各自持有自己的 sink，从不共享。</li>
 *   <li>{@link #commit(Path, boolean)} 之前一定先 {@link #sync()}，保证移动到位的文件内容已经持久化。</li>
 *   <li>放弃上传时调用 {@link #abandon()} 删除临时文件；删除失败只记日志，不向上抛。</li>
 * </ul>
 */
public final class TransferSink implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(TransferSink.class);

    private final Path tempFile;
    private final FileChannel channel;
    private final OutputStream out;
    private long bytesWritten;
    private boolean closed;

    private TransferSink(Path tempFile, FileChannel channel, int bufferSize) {
        this.tempFile = tempFile;
        this.channel = channel;
        this.out = new BufferedOutputStream(Channels.newOutputStream(channel), bufferSize);
    }

    /**
     * 新建临时文件并打开写入通道；临时文件已存在时失败（{@link FileAlreadyExistsException}）。
     */
    public static TransferSink create(Path tempFile, int bufferSize) throws IOException {
        FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        return new TransferSink(tempFile, channel, Math.max(8192, bufferSize));
    }

    public Path tempFile() {
        return tempFile;
    }

    public long bytesWritten() {
        return bytesWritten;
    }

    public void write(byte[] bytes, int offset, int length) throws IOException {
        ensureOpen();
        out.write(bytes, offset, length);
        bytesWritten += length;
    }

    public void write(ByteBuffer buffer) throws IOException {
        ensureOpen();
        int length = buffer.remaining();
        if (buffer.hasArray()) {
            out.write(buffer.array(), buffer.arrayOffset() + buffer.position(), length);
            buffer.position(buffer.limit());
        } else {
            byte[] copy = new byte[length];
            buffer.get(copy);
            out.write(copy);
        }
        bytesWritten += length;
    }

    /**
     * 把输入流全部追加到临时文件，返回本次写入的字节数。
     */
    public long transferFrom(InputStream in) throws IOException {
        ensureOpen();
        byte[] buffer = new byte[64 * 1024];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) >= 0) {
            out.write(buffer, 0, read);
            total += read;
        }
        bytesWritten += total;
        return total;
    }

    /**
     * flush 缓冲区并 fsync，随后关闭文件句柄。可重复调用。
     */
    public void sync() throws IOException {
        if (closed) {
            return;
        }
        try {
            out.flush();
            channel.force(true);
        } finally {
            closed = true;
            out.close();
        }
    }

    /**
     * 持久化后把临时文件移动到目标路径（同目录内优先原子移动，不支持时降级为普通 move）。
     *
     * @param overwrite 目标已存在时是否替换；为 false 且目标存在时抛出 {@link FileAlreadyExistsException}
     */
    public void commit(Path target, boolean overwrite) throws IOException {
        sync();
        moveIntoPlace(tempFile, target, overwrite);
    }

    /**
     * 放弃本次写入：关闭句柄并删除临时文件（尽力而为）。
     */
    public void abandon() {
        if (!closed) {
            closed = true;
            try {
                out.close();
            } catch (IOException e) {
                log.warn("关闭临时文件失败：{}", tempFile, e);
            }
        }
        CleanupUtils.deleteQuietly(tempFile);
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            out.close();
        }
    }

    public static void moveIntoPlace(Path source, Path target, boolean overwrite) throws IOException {
        if (!overwrite) {
            // ATOMIC_MOVE 在目标已存在时是否替换由实现决定，不覆盖的场景只能用普通 move
            Files.move(source, target);
            return;
        }
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("写入通道已关闭：" + tempFile);
        }
    }
}
