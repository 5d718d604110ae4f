package org.filest.web;

import jakarta.validation.Valid;
import org.filest.filesystem.ErrorCode;
import org.filest.filesystem.TransferException;
import org.filest.filesystem.dto.ChunkReceivedResult;
import org.filest.filesystem.dto.ChunkedInitRequest;
import org.filest.filesystem.dto.ChunkedInitResult;
import org.filest.filesystem.dto.UploadIdRequest;
import org.filest.filesystem.dto.UploadResult;
import org.filest.filesystem.dto.UploadedFile;
import org.filest.upload.ChunkedUploadService;
import org.filest.upload.DirectUploadService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * 上传接口：一次性 multipart 上传与分片上传（init / chunk / complete / abort）。
 * <p>
 * 认证由 {@link BasicAuthFilter} 负责；业务异常由 {@link UploadExceptionHandler} 统一转换成响应。
 */
@RestController
@RequestMapping("/api/upload")
public class UploadController {

    private final ChunkedUploadService chunkedUploadService;
    private final DirectUploadService directUploadService;

    public UploadController(ChunkedUploadService chunkedUploadService, DirectUploadService directUploadService) {
        this.chunkedUploadService = chunkedUploadService;
        this.directUploadService = directUploadService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ApiResponse<UploadResult> upload(
            @RequestParam(value = "path", required = false) String path,
            @RequestParam(value = "files", required = false) List<MultipartFile> files
    ) {
        return ApiResponse.ok(directUploadService.upload(path, files));
    }

    @PostMapping("/init")
    public ApiResponse<ChunkedInitResult> init(@Valid @RequestBody ChunkedInitRequest request) {
        return ApiResponse.ok(chunkedUploadService.init(
                request.path(),
                request.filename(),
                request.totalSize(),
                request.chunkSize(),
                request.totalChunks()
        ));
    }

    /**
     * 分片内容为原始请求体（通常是 {@code application/octet-stream}）。
     */
    @PostMapping("/chunk")
    public ApiResponse<ChunkReceivedResult> chunk(
            @RequestParam("uploadId") String uploadId,
            @RequestParam("chunkIndex") int chunkIndex,
            InputStream body
    ) {
        return ApiResponse.ok(chunkedUploadService.putChunk(uploadId, chunkIndex, body));
    }

    /**
     * 分片内容放在 multipart 的 {@code chunk} 字段里。
     */
    @PostMapping(value = "/chunk", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ApiResponse<ChunkReceivedResult> chunkMultipart(
            @RequestParam("uploadId") String uploadId,
            @RequestParam("chunkIndex") int chunkIndex,
            @RequestParam("chunk") MultipartFile chunk
    ) {
        try (InputStream in = chunk.getInputStream()) {
            return ApiResponse.ok(chunkedUploadService.putChunk(uploadId, chunkIndex, in));
        } catch (IOException e) {
            throw new TransferException(ErrorCode.IO_FAILURE, "读取分片数据失败：" + chunkIndex, e);
        }
    }

    @PostMapping("/complete")
    public ApiResponse<UploadedFile> complete(@Valid @RequestBody UploadIdRequest request) {
        return ApiResponse.ok(chunkedUploadService.complete(request.uploadId()));
    }

    /**
     * 幂等：会话不存在（或请求体为空）也返回成功。
     */
    @PostMapping("/abort")
    public ApiResponse<Void> abort(@RequestBody(required = false) UploadIdRequest request) {
        if (request != null) {
            chunkedUploadService.abort(request.uploadId());
        }
        return ApiResponse.ok();
    }
}
