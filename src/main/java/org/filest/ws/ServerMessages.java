package org.filest.ws;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WebSocket 上传协议中服务端发给客户端的消息（JSON 文本帧，{@code type} 字段区分类型）。
 */
final class ServerMessages {

    static final String INVALID_MESSAGE = "INVALID_MESSAGE";
    static final String INIT_FAILED = "INIT_FAILED";
    static final String COMPLETE_FAILED = "COMPLETE_FAILED";
    static final String ALREADY_EXISTS = "ALREADY_EXISTS";
    static final String WRITE_FAILED = "WRITE_FAILED";
    static final String NO_SESSION = "NO_SESSION";

    private ServerMessages() {
    }

    static Map<String, Object> authRequired() {
        return message("auth_required");
    }

    static Map<String, Object> authOk() {
        return message("auth_ok");
    }

    static Map<String, Object> authFailed(String reason) {
        Map<String, Object> m = message("auth_failed");
        m.put("message", reason);
        return m;
    }

    static Map<String, Object> initOk(String uploadId) {
        Map<String, Object> m = message("init_ok");
        m.put("upload_id", uploadId);
        return m;
    }

    static Map<String, Object> progress(long received, long total) {
        Map<String, Object> m = message("progress");
        m.put("received", received);
        m.put("total", total);
        m.put("percent", percent(received, total));
        return m;
    }

    static Map<String, Object> completeOk(String path, long size) {
        Map<String, Object> m = message("complete_ok");
        m.put("path", path);
        m.put("size", size);
        return m;
    }

    static Map<String, Object> error(String code, String reason) {
        Map<String, Object> m = message("error");
        m.put("code", code);
        m.put("message", reason);
        return m;
    }

    static int percent(long received, long total) {
        if (total <= 0) {
            return 0;
        }
        double ratio = (double) received / (double) total;
        return (int) Math.max(0, Math.min(100, Math.floor(ratio * 100.0)));
    }

    private static Map<String, Object> message(String type) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        return m;
    }
}
