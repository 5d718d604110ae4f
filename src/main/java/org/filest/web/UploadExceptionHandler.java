package org.filest.web;

import org.filest.filesystem.ErrorCode;
import org.filest.filesystem.MissingChunksException;
import org.filest.filesystem.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.stream.Collectors;

/**
 * 把上传链路的异常翻译成 {@link ApiResponse} 与对应的 HTTP 状态码。
 */
@RestControllerAdvice
public class UploadExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(UploadExceptionHandler.class);

    @ExceptionHandler(MissingChunksException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingChunks(MissingChunksException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.missingChunks(e.getCode().name(), e.getMessage(), e.getMissing()));
    }

    @ExceptionHandler(TransferException.class)
    public ResponseEntity<ApiResponse<Void>> handleTransfer(TransferException e) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.error("上传请求失败：{}", e.getMessage(), e);
        } else {
            log.debug("上传请求被拒绝：{} {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(e.getCode().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalid(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(", "));
        return protocolError("参数错误：" + detail);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleMalformed(Exception e) {
        return protocolError("请求格式错误：" + e.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error(ErrorCode.PROTOCOL_ERROR.name(), "上传内容超过大小限制"));
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND, SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS, MISSING_CHUNKS -> HttpStatus.CONFLICT;
            case INVALID_INDEX, PROTOCOL_ERROR -> HttpStatus.BAD_REQUEST;
            case AUTH_REQUIRED, AUTH_FAILED -> HttpStatus.UNAUTHORIZED;
            case IO_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ApiResponse<Void>> protocolError(String message) {
        return ResponseEntity.badRequest().body(ApiResponse.error(ErrorCode.PROTOCOL_ERROR.name(), message));
    }
}
