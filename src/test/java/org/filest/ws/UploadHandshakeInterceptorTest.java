package org.filest.ws;

import org.filest.web.CredentialVerifier;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UploadHandshakeInterceptorTest {

    private final UploadHandshakeInterceptor interceptor =
            new UploadHandshakeInterceptor(new CredentialVerifier("admin", "secret"));

    @Test
    void validAuthParam_marksConnectionAuthenticated() {
        String token = Base64.getEncoder().encodeToString("admin:secret".getBytes(StandardCharsets.UTF_8));

        assertThat(handshake("auth=" + token.replace("=", "%3D"))).containsEntry(UploadHandshakeInterceptor.PRE_AUTHENTICATED, true);
    }

    @Test
    void missingOrWrongAuthParam_stillAcceptsHandshake() {
        String wrong = Base64.getEncoder().encodeToString("admin:nope".getBytes(StandardCharsets.UTF_8));

        assertThat(handshake(null)).containsEntry(UploadHandshakeInterceptor.PRE_AUTHENTICATED, false);
        assertThat(handshake("auth=" + wrong)).containsEntry(UploadHandshakeInterceptor.PRE_AUTHENTICATED, false);
        assertThat(handshake("auth=not-base64")).containsEntry(UploadHandshakeInterceptor.PRE_AUTHENTICATED, false);
    }

    private Map<String, Object> handshake(String query) {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/api/ws/upload");
        servletRequest.setQueryString(query);
        Map<String, Object> attributes = new HashMap<>();

        boolean proceed = interceptor.beforeHandshake(
                new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(new MockHttpServletResponse()),
                null,
                attributes);

        assertThat(proceed).isTrue();
        return attributes;
    }
}
