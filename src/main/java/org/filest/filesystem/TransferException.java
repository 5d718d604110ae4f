package org.filest.filesystem;

/**
 * 上传链路中的业务异常，携带 {@link ErrorCode}，由 REST 层与 WebSocket 层各自翻译成对外响应。
 */
public class TransferException extends RuntimeException {

    private final ErrorCode code;

    public TransferException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public TransferException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static TransferException accessDenied() {
        return new TransferException(ErrorCode.ACCESS_DENIED, "访问被拒绝：路径无效");
    }

    public static TransferException sessionNotFound(String uploadId) {
        return new TransferException(ErrorCode.SESSION_NOT_FOUND, "上传会话不存在或已结束：" + uploadId);
    }

    public static TransferException ioFailure(String message, Throwable cause) {
        return new TransferException(ErrorCode.IO_FAILURE, message, cause);
    }
}
