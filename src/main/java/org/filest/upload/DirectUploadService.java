package org.filest.upload;

import org.filest.filesystem.ErrorCode;
import org.filest.filesystem.FileServerProperties;
import org.filest.filesystem.SandboxPathResolver;
import org.filest.filesystem.SandboxedPath;
import org.filest.filesystem.TransferException;
import org.filest.filesystem.TransferSink;
import org.filest.filesystem.dto.UploadResult;
import org.filest.filesystem.dto.UploadedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 一次性 multipart 上传：每个文件流式写入目标目录下的临时文件，fsync 后移动到位。
 * <p>
 * 某个文件失败时整个请求失败；之前已经保存的文件保留，失败文件的临时文件会被删除。
 */
public class DirectUploadService {

    private static final Logger log = LoggerFactory.getLogger(DirectUploadService.class);

    /**
     * 客户端没有提供文件名时使用的名称。
     */
    static final String UNKNOWN_FILE_NAME = "unknown";

    private final SandboxPathResolver pathResolver;
    private final boolean overwrite;
    private final int bufferSize;

    public DirectUploadService(SandboxPathResolver pathResolver, FileServerProperties properties) {
        this.pathResolver = pathResolver;
        this.overwrite = properties.isOverwriteExisting();
        this.bufferSize = (int) Math.min(Integer.MAX_VALUE, properties.getWriteBufferSize().toBytes());
    }

    public UploadResult upload(String path, List<MultipartFile> files) {
        // 先校验目录，路径非法时不碰任何文件
        pathResolver.resolve(path);

        List<UploadedFile> uploaded = new ArrayList<>();
        if (files == null) {
            return new UploadResult(uploaded);
        }
        for (MultipartFile file : files) {
            String name = file.getOriginalFilename();
            if (name == null || name.isBlank()) {
                name = UNKNOWN_FILE_NAME;
            }
            SandboxedPath target = pathResolver.resolveFile(path, name);
            try (InputStream in = file.getInputStream()) {
                long size = store(target, in);
                uploaded.add(new UploadedFile(name, size, target.displayPath()));
            } catch (IOException e) {
                throw TransferException.ioFailure("读取上传数据失败：" + name, e);
            }
        }
        log.info("上传完成：{} 个文件 -> {}", uploaded.size(), path == null || path.isBlank() ? "/" : path);
        return new UploadResult(uploaded);
    }

    private long store(SandboxedPath target, InputStream in) {
        Path directory = target.actual().getParent();
        TransferSink sink = null;
        try {
            Files.createDirectories(directory);
            sink = TransferSink.create(directory.resolve(".upload_" + UUID.randomUUID() + ".tmp"), bufferSize);
            sink.transferFrom(in);
            long size = sink.bytesWritten();
            sink.commit(target.actual(), overwrite);
            return size;
        } catch (FileAlreadyExistsException e) {
            if (sink != null) {
                sink.abandon();
                throw new TransferException(ErrorCode.ALREADY_EXISTS, "目标文件已存在：" + target.displayPath(), e);
            }
            throw TransferException.ioFailure("创建目录失败：" + target.displayPath(), e);
        } catch (IOException e) {
            if (sink != null) {
                sink.abandon();
            }
            log.error("写入文件失败：{}", target.displayPath(), e);
            throw TransferException.ioFailure("写入文件失败：" + target.displayPath(), e);
        }
    }
}
