package com.example.reportsync.webhook;

import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Verifies X-Hub-Signature-256 headers: {@code sha256=<hex hmac-sha256(secret, raw body)>}.
 *
 * The digest comparison always walks the whole string so the response time does not
 * reveal how many leading characters matched.
 */
@Component
public class WebhookSignatureVerifier {

    static final String SIGNATURE_PREFIX = "sha256=";

    public enum Verification {
        ACCEPTED,
        /** No secret configured for the integration, signature checking is off. */
        DISABLED,
        MISSING_SIGNATURE,
        INVALID_SIGNATURE
    }

    public Verification verify(byte[] payload, String signatureHeader, String secret) {
        if (secret == null || secret.isEmpty()) {
            return Verification.DISABLED;
        }
        if (signatureHeader == null || signatureHeader.isEmpty()) {
            return Verification.MISSING_SIGNATURE;
        }
        if (!signatureHeader.startsWith(SIGNATURE_PREFIX)) {
            return Verification.INVALID_SIGNATURE;
        }
        String received = signatureHeader.substring(SIGNATURE_PREFIX.length());
        String expected = hmacHex(payload, secret);
        return constantTimeEquals(received, expected) ? Verification.ACCEPTED : Verification.INVALID_SIGNATURE;
    }

    /**
     * Header value GitHub would send for this payload and secret.
     */
    public static String sign(byte[] payload, String secret) {
        return SIGNATURE_PREFIX + hmacHex(payload, secret);
    }

    private static String hmacHex(byte[] payload, String secret) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret.getBytes(StandardCharsets.UTF_8)).hmacHex(payload);
    }

    static boolean constantTimeEquals(String received, String expected) {
        byte[] a = received.getBytes(StandardCharsets.UTF_8);
        byte[] b = expected.getBytes(StandardCharsets.UTF_8);
        if (a.length != b.length) {
            return false;
        }
        int diff = 0;
        for (int i = 0; i < a.length; i++) {
            diff |= a[i] ^ b[i];
        }
        return diff == 0;
    }
}
