package com.tracker.adapter.out.webhook;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signatures over webhook bodies, rendered as a bare lowercase hex digest.
 * Receivers recompute the value with the shared secret to authenticate a delivery.
 */
public final class WebhookSigner {

    public static final String ALGORITHM = "HmacSHA256";

    private WebhookSigner() {}

    public static String sign(String body, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /**
     * Constant-time comparison of a received signature with the expected one.
     */
    public static boolean verify(String body, String signature, String secret) {
        if (signature == null || secret == null) {
            return false;
        }
        byte[] expected = sign(body, secret).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8));
    }
}
