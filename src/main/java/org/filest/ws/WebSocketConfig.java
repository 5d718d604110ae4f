package org.filest.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.filest.filesystem.FileServerProperties;
import org.filest.filesystem.SandboxPathResolver;
import org.filest.web.CredentialVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket 上传端点装配。
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final StreamingUploadHandler handler;
    private final UploadHandshakeInterceptor handshakeInterceptor;

    public WebSocketConfig(
            SandboxPathResolver pathResolver,
            CredentialVerifier credentialVerifier,
            ObjectMapper objectMapper,
            FileServerProperties properties
    ) {
        this.handler = new StreamingUploadHandler(
                pathResolver, credentialVerifier, objectMapper, StreamUploadSettings.from(properties));
        this.handshakeInterceptor = new UploadHandshakeInterceptor(credentialVerifier);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/api/ws/upload")
                .addInterceptors(handshakeInterceptor)
                .setAllowedOrigins("*");
    }

    /**
     * 放大容器的二进制消息缓冲区，默认 8KB 装不下客户端的大分帧。
     */
    @Bean
    public ServletServerContainerFactoryBean webSocketContainer(FileServerProperties properties) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        int frameSize = (int) Math.min(Integer.MAX_VALUE, properties.getWsMaxFrameSize().toBytes());
        container.setMaxBinaryMessageBufferSize(frameSize);
        container.setMaxTextMessageBufferSize(64 * 1024);
        return container;
    }
}
