package com.fulfillment.pipeline.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over the exact request bytes, hex encoded. Fails closed on any irregularity.
 */
@Slf4j
@Component
public class SignatureVerifier {

    static final String ALGORITHM = "HmacSHA256";
    private static final String SHA256_PREFIX = "sha256=";

    public boolean verify(byte[] rawBody, String signatureHeader, String secret) {
        if (rawBody == null || signatureHeader == null || signatureHeader.isBlank()
                || secret == null || secret.isEmpty()) {
            return false;
        }
        byte[] supplied;
        try {
            supplied = HexFormat.of().parseHex(stripPrefix(signatureHeader.trim()));
        } catch (IllegalArgumentException e) {
            log.debug("Signature header is not valid hex");
            return false;
        }
        byte[] expected = hmac(rawBody, secret);
        // constant-time; also false on length mismatch
        return MessageDigest.isEqual(expected, supplied);
    }

    /** Hex-encoded HMAC of {@code payload}; also used to sign payment initiation references. */
    public String sign(byte[] payload, String secret) {
        return HexFormat.of().formatHex(hmac(payload, secret));
    }

    public String sign(String payload, String secret) {
        return sign(payload.getBytes(StandardCharsets.UTF_8), secret);
    }

    private static byte[] hmac(byte[] payload, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static String stripPrefix(String header) {
        return header.regionMatches(true, 0, SHA256_PREFIX, 0, SHA256_PREFIX.length())
                ? header.substring(SHA256_PREFIX.length())
                : header;
    }
}
