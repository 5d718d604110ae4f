package org.filest.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.filest.filesystem.SandboxPathResolver;
import org.filest.filesystem.SandboxedPath;
import org.filest.filesystem.TransferException;
import org.filest.filesystem.TransferSink;
import org.filest.web.CredentialVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

/**
 * 单个 WebSocket 连接上的上传协议状态机。
 * <p>
 * 状态：{@code AWAITING_AUTH -> AUTHENTICATED -> SESSION_OPEN -> {COMPLETED, CANCELLED, CLOSED}}。
 * <ul>
 *   <li>握手时已通过 {@code auth} 查询参数认证的连接直接从 AUTHENTICATED 开始，否则先发 {@code auth_required}。</li>
 *   <li>认证失败不断开连接，客户端可以重试；认证前的 init / 二进制帧只会收到 {@code auth_required}。</li>
 *   <li>init 在目标目录内创建临时文件，complete 时 fsync 后同目录重命名到位。</li>
 *   <li>cancel 或连接异常关闭时删除临时文件（尽力而为，失败只记日志）。</li>
 *   <li>complete 失败时<b>不</b>删除临时文件，留给人工排查。</li>
 * </ul>
 * {@link #onText} / {@link #onBinary} 返回 false 表示本连接的消息循环结束（一个连接只传一个文件），
 * 调用方应当关闭连接。
 * <p>
 * 同一连接的消息由容器顺序投递，本类不做同步。
 */
public class StreamUploadConnection {

    private static final Logger log = LoggerFactory.getLogger(StreamUploadConnection.class);

    public enum State {
        AWAITING_AUTH,
        AUTHENTICATED,
        SESSION_OPEN,
        COMPLETED,
        CANCELLED,
        CLOSED
    }

    /**
     * 发往客户端的消息出口。
     */
    @FunctionalInterface
    public interface Outbound {
        void send(Map<String, Object> message) throws IOException;
    }

    private final SandboxPathResolver pathResolver;
    private final CredentialVerifier credentialVerifier;
    private final ObjectMapper objectMapper;
    private final StreamUploadSettings settings;
    private final Outbound outbound;

    private State state;
    private StreamSession session;

    public StreamUploadConnection(
            SandboxPathResolver pathResolver,
            CredentialVerifier credentialVerifier,
            ObjectMapper objectMapper,
            StreamUploadSettings settings,
            Outbound outbound,
            boolean preAuthenticated
    ) {
        this.pathResolver = pathResolver;
        this.credentialVerifier = credentialVerifier;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.outbound = outbound;
        this.state = preAuthenticated ? State.AUTHENTICATED : State.AWAITING_AUTH;
    }

    public State state() {
        return state;
    }

    public void open() {
        if (state == State.AWAITING_AUTH) {
            send(ServerMessages.authRequired());
        }
    }

    public boolean onText(String payload) {
        if (isFinished()) {
            return false;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            send(ServerMessages.error(ServerMessages.INVALID_MESSAGE, "Invalid JSON: " + e.getOriginalMessage()));
            return true;
        }
        if (node == null || !node.isObject()) {
            send(ServerMessages.error(ServerMessages.INVALID_MESSAGE, "Invalid JSON: expected an object"));
            return true;
        }

        String type = node.path("type").asText("");
        switch (type) {
            case "auth":
                return handleAuth(node);
            case "init":
                return handleInit(node);
            case "complete":
                return handleComplete();
            case "cancel":
                return handleCancel();
            default:
                send(ServerMessages.error(ServerMessages.INVALID_MESSAGE, "Unknown message type: " + type));
                return true;
        }
    }

    public boolean onBinary(ByteBuffer data) {
        if (isFinished()) {
            return false;
        }
        if (!isAuthenticated()) {
            send(ServerMessages.authRequired());
            return true;
        }
        if (session == null) {
            send(ServerMessages.error(ServerMessages.NO_SESSION, "Upload not initialized"));
            return true;
        }

        StreamSession s = session;
        int length = data.remaining();
        try {
            s.sink().write(data);
        } catch (IOException e) {
            log.error("写入上传数据失败：{}", s.uploadId(), e);
            send(ServerMessages.error(ServerMessages.WRITE_FAILED, "Write failed: " + e.getMessage()));
            s.sink().abandon();
            session = null;
            state = State.CLOSED;
            return false;
        }

        long previous = s.addReceived(length);
        long received = s.receivedSize();
        // 只在跨过进度间隔或到达声明大小时推送
        long interval = settings.progressInterval();
        if (previous / interval < received / interval || received == s.totalSize()) {
            send(ServerMessages.progress(received, s.totalSize()));
        }
        return true;
    }

    /**
     * 连接已关闭（客户端断开、网络异常或服务端主动关闭）。
     */
    public void onClose() {
        if (session != null) {
            StreamSession s = session;
            session = null;
            s.sink().abandon();
            log.warn("上传连接意外关闭，已清理临时文件：{}（{}）", s.uploadId(), s.target().displayPath());
        }
        if (!isFinished()) {
            state = State.CLOSED;
        }
    }

    private boolean handleAuth(JsonNode node) {
        String username = textField(node, "username");
        String password = textField(node, "password");
        if (username == null || password == null) {
            send(ServerMessages.error(ServerMessages.INVALID_MESSAGE, "Invalid message: auth requires username and password"));
            return true;
        }
        if (credentialVerifier.verify(username, password)) {
            if (state == State.AWAITING_AUTH) {
                state = State.AUTHENTICATED;
            }
            send(ServerMessages.authOk());
        } else {
            send(ServerMessages.authFailed("Invalid credentials"));
        }
        return true;
    }

    private boolean handleInit(JsonNode node) {
        if (!isAuthenticated()) {
            send(ServerMessages.authRequired());
            return true;
        }
        String fileName = textField(node, "filename");
        JsonNode sizeNode = node.get("size");
        if (fileName == null || sizeNode == null || !sizeNode.canConvertToLong() || sizeNode.asLong() < 0) {
            send(ServerMessages.error(ServerMessages.INVALID_MESSAGE, "Invalid message: init requires filename and size"));
            return true;
        }
        if (session != null) {
            send(ServerMessages.error(ServerMessages.INIT_FAILED, "Upload already initialized: " + session.uploadId()));
            return true;
        }

        String path = node.path("path").asText("");
        long size = sizeNode.asLong();
        TransferSink sink = null;
        try {
            SandboxedPath target = pathResolver.resolveFile(path, fileName);
            if (!settings.overwrite() && Files.exists(target.actual(), LinkOption.NOFOLLOW_LINKS)) {
                send(ServerMessages.error(ServerMessages.ALREADY_EXISTS, "File already exists: " + target.displayPath()));
                return true;
            }
            Path directory = target.actual().getParent();
            Files.createDirectories(directory);
            // 临时文件放在目标目录里，complete 时是同一文件系统内的重命名
            String uploadId = UUID.randomUUID().toString();
            sink = TransferSink.create(directory.resolve(".upload_" + uploadId + ".tmp"), settings.bufferSize());
            session = new StreamSession(uploadId, target, size, sink);
            state = State.SESSION_OPEN;
            log.info("WebSocket 上传会话已创建：{} -> {}（{} 字节）", uploadId, target.displayPath(), size);
            send(ServerMessages.initOk(uploadId));
        } catch (TransferException e) {
            send(ServerMessages.error(ServerMessages.INIT_FAILED, e.getMessage()));
        } catch (IOException e) {
            if (sink != null) {
                sink.abandon();
            }
            log.warn("创建上传会话失败：{}", fileName, e);
            send(ServerMessages.error(ServerMessages.INIT_FAILED, "Failed to create temp file: " + e.getMessage()));
        }
        return true;
    }

    private boolean handleComplete() {
        if (!isAuthenticated()) {
            send(ServerMessages.authRequired());
            return true;
        }
        if (session == null) {
            send(ServerMessages.error(ServerMessages.NO_SESSION, "Upload not initialized"));
            return true;
        }

        StreamSession s = session;
        session = null;
        try {
            s.sink().commit(s.target().actual(), settings.overwrite());
        } catch (FileAlreadyExistsException e) {
            // init 之后目标被别人创建了
            s.sink().abandon();
            log.warn("目标文件已存在，放弃上传：{}", s.target().displayPath());
            state = State.CLOSED;
            send(ServerMessages.error(ServerMessages.ALREADY_EXISTS, "File already exists: " + s.target().displayPath()));
            return false;
        } catch (IOException e) {
            // 这里不删除临时文件（与 cancel 不同），保留现场
            log.error("完成上传失败，临时文件保留在 {}：{}", s.sink().tempFile(), s.uploadId(), e);
            state = State.CLOSED;
            send(ServerMessages.error(ServerMessages.COMPLETE_FAILED, "Failed to move file: " + e.getMessage()));
            return false;
        }
        if (s.receivedSize() != s.totalSize()) {
            log.warn("上传大小与声明不一致：{}，声明 {} 字节，实际 {} 字节", s.uploadId(), s.totalSize(), s.receivedSize());
        }
        state = State.COMPLETED;
        log.info("WebSocket 上传完成：{}（{} 字节）", s.target().displayPath(), s.receivedSize());
        send(ServerMessages.completeOk(s.target().displayPath(), s.receivedSize()));
        return false;
    }

    private boolean handleCancel() {
        if (session != null) {
            StreamSession s = session;
            session = null;
            s.sink().abandon();
            log.info("WebSocket 上传已取消：{}", s.target().displayPath());
        }
        state = State.CANCELLED;
        return false;
    }

    private boolean isAuthenticated() {
        return state == State.AUTHENTICATED || state == State.SESSION_OPEN;
    }

    private boolean isFinished() {
        return state == State.COMPLETED || state == State.CANCELLED || state == State.CLOSED;
    }

    private void send(Map<String, Object> message) {
        try {
            outbound.send(message);
        } catch (IOException e) {
            // 对端可能已经断开；连接关闭时会走 onClose 清理
            log.warn("发送 WebSocket 消息失败：{}", message.get("type"), e);
        }
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return (value == null || !value.isTextual()) ? null : value.asText();
    }
}
