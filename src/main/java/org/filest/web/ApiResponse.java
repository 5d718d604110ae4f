package org.filest.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;

/**
 * REST 接口统一响应：{@code {success, error?, code?, missing?, ...data}}，data 的字段平铺到顶层。
 *
 * @param success 是否成功
 * @param error   失败原因（成功时为空）
 * @param code    错误码，见 {@link org.filest.filesystem.ErrorCode}
 * @param missing 完成分片上传时缺少的分片下标（仅 MISSING_CHUNKS）
 * @param data    业务数据
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        String error,
        String code,
        List<Integer> missing,
        @JsonUnwrapped T data
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, null, null, data);
    }

    public static ApiResponse<Void> ok() {
        return new ApiResponse<>(true, null, null, null, null);
    }

    public static ApiResponse<Void> error(String code, String message) {
        return new ApiResponse<>(false, message, code, null, null);
    }

    public static ApiResponse<Void> missingChunks(String code, String message, List<Integer> missing) {
        return new ApiResponse<>(false, message, code, missing, null);
    }
}
