package org.nowstart.dca.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Computes the {@code API-Sign} header: HMAC-SHA512 over the URI path followed by SHA-256(nonce + post data),
 * keyed with the base64-decoded private key.
 */
@RequiredArgsConstructor
public class KrakenSigner {

    @Getter
    private final String apiKey;
    private final String apiSecret;

    public String sign(String uriPath, long nonce, String postData) {
        if (apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalStateException("Kraken API secret is not configured");
        }

        byte[] pathBytes = uriPath.getBytes(StandardCharsets.UTF_8);
        byte[] digest = sha256(nonce + postData);
        byte[] message = new byte[pathBytes.length + digest.length];
        System.arraycopy(pathBytes, 0, message, 0, pathBytes.length);
        System.arraycopy(digest, 0, message, pathBytes.length, digest.length);

        return hmacSha512Base64(message, apiSecret);
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String hmacSha512Base64(byte[] message, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA512");
            mac.init(new SecretKeySpec(Base64.getDecoder().decode(secret), "HmacSHA512"));
            return Base64.getEncoder().encodeToString(mac.doFinal(message));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign Kraken request", e);
        }
    }
}
