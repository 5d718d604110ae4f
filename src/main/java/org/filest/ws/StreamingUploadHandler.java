package org.filest.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.filest.filesystem.SandboxPathResolver;
import org.filest.web.CredentialVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;

/**
 * {@code /api/ws/upload} 的 WebSocket 处理器：把容器回调转交给每个连接自己的 {@link StreamUploadConnection}。
 * <p>
 * 连接状态存放在 {@link WebSocketSession#getAttributes()} 里，连接之间没有共享的可变状态。
 */
public class StreamingUploadHandler extends AbstractWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(StreamingUploadHandler.class);

    static final String CONNECTION_ATTRIBUTE = StreamUploadConnection.class.getName();

    private final SandboxPathResolver pathResolver;
    private final CredentialVerifier credentialVerifier;
    private final ObjectMapper objectMapper;
    private final StreamUploadSettings settings;

    public StreamingUploadHandler(
            SandboxPathResolver pathResolver,
            CredentialVerifier credentialVerifier,
            ObjectMapper objectMapper,
            StreamUploadSettings settings
    ) {
        this.pathResolver = pathResolver;
        this.credentialVerifier = credentialVerifier;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        boolean preAuthenticated = Boolean.TRUE.equals(
                session.getAttributes().get(UploadHandshakeInterceptor.PRE_AUTHENTICATED));
        StreamUploadConnection connection = new StreamUploadConnection(
                pathResolver,
                credentialVerifier,
                objectMapper,
                settings,
                message -> session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message))),
                preAuthenticated
        );
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
        connection.open();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        StreamUploadConnection connection = connection(session);
        if (connection != null && !connection.onText(message.getPayload())) {
            closeQuietly(session);
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        StreamUploadConnection connection = connection(session);
        if (connection != null && !connection.onBinary(message.getPayload())) {
            closeQuietly(session);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket 传输错误：{}", session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        StreamUploadConnection connection = connection(session);
        if (connection != null) {
            connection.onClose();
            session.getAttributes().remove(CONNECTION_ATTRIBUTE);
        }
    }

    private static StreamUploadConnection connection(WebSocketSession session) {
        Object value = session.getAttributes().get(CONNECTION_ATTRIBUTE);
        return value instanceof StreamUploadConnection c ? c : null;
    }

    private static void closeQuietly(WebSocketSession session) {
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.NORMAL);
            }
        } catch (IOException e) {
            log.warn("关闭 WebSocket 连接失败：{}", session.getId(), e);
        }
    }
}
