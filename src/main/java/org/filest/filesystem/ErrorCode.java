package org.filest.filesystem;

/**
 * 传输相关错误的类型。REST 接口与 WebSocket 协议都以 {@link #name()} 作为对外的错误码。
 */
public enum ErrorCode {
    /** 路径越出沙箱（不区分是 {@code ..} 穿越还是链接逃逸）。 */
    ACCESS_DENIED,
    NOT_FOUND,
    ALREADY_EXISTS,
    SESSION_NOT_FOUND,
    INVALID_INDEX,
    MISSING_CHUNKS,
    IO_FAILURE,
    AUTH_REQUIRED,
    AUTH_FAILED,
    /** 报文格式错误或调用顺序错误。 */
    PROTOCOL_ERROR
}
