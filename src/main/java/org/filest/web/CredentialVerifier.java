package org.filest.web;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Optional;

/**
 * 单用户凭据校验（HTTP Basic 中间件与 WebSocket 内联认证共用）。
 * <p>
 * 比较使用 {@link MessageDigest#isEqual}，耗时与内容无关。
 */
public class CredentialVerifier {

    private final byte[] username;
    private final byte[] password;

    public CredentialVerifier(String username, String password) {
        this.username = username.getBytes(StandardCharsets.UTF_8);
        this.password = password.getBytes(StandardCharsets.UTF_8);
    }

    public boolean verify(String username, String password) {
        if (username == null || password == null) {
            return false;
        }
        // 两项都比较完再合并结果，不因用户名不匹配提前返回
        boolean userOk = MessageDigest.isEqual(this.username, username.getBytes(StandardCharsets.UTF_8));
        boolean passOk = MessageDigest.isEqual(this.password, password.getBytes(StandardCharsets.UTF_8));
        return userOk & passOk;
    }

    /**
     * 校验 base64 编码的 {@code username:password}（Basic 头的凭据部分，或 WebSocket 的 auth 查询参数）。
     */
    public boolean verifyEncoded(String encoded) {
        return decode(encoded)
                .map(c -> verify(c.username(), c.password()))
                .orElse(false);
    }

    public static Optional<Credentials> decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return Optional.empty();
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        return Optional.of(new Credentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
    }

    public record Credentials(String username, String password) {
    }
}
