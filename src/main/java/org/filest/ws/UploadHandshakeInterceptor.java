package org.filest.ws;

import org.filest.web.CredentialVerifier;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * 握手阶段读取 {@code ?auth=<base64(username:password)>}，把校验结果放进连接属性。
 * <p>
 * 校验失败也照常握手：连接会从 AWAITING_AUTH 开始，由协议内的 auth 消息完成认证。
 */
public class UploadHandshakeInterceptor implements HandshakeInterceptor {

    public static final String PRE_AUTHENTICATED = "filest.ws.preAuthenticated";

    private final CredentialVerifier credentialVerifier;

    public UploadHandshakeInterceptor(CredentialVerifier credentialVerifier) {
        this.credentialVerifier = credentialVerifier;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String auth = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("auth");
        boolean authenticated = auth != null
                && credentialVerifier.verifyEncoded(UriUtils.decode(auth, StandardCharsets.UTF_8));
        attributes.put(PRE_AUTHENTICATED, authenticated);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }
}
