package com.tableflow.tableflow_automation.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 signatures in the {@code sha256=<hex>} form, over canonical JSON bodies.
 * The bytes returned by {@link #canonicalJson(Object)} are exactly the bytes sent and signed.
 */
@Component
public class WebhookSigner {

    public static final String SIGNATURE_PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private final ObjectMapper canonicalMapper;

    public WebhookSigner(ObjectMapper objectMapper) {
        // Map keys sorted at every nesting level
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public byte[] canonicalJson(Object payload) {
        try {
            return canonicalMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable to JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String sign(byte[] body, String secret) {
        return SIGNATURE_PREFIX + hmacHex(body, secret);
    }

    /** Accepts the signature with or without the sha256= prefix; compares in constant time. */
    public boolean verify(byte[] body, String secret, String providedSignature) {
        if (secret == null || secret.isEmpty() || providedSignature == null) return false;
        String provided = providedSignature.trim().toLowerCase(Locale.ROOT);
        if (provided.startsWith(SIGNATURE_PREFIX)) {
            provided = provided.substring(SIGNATURE_PREFIX.length());
        }
        byte[] expected = hmacHex(body, secret).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.US_ASCII));
    }

    private static String hmacHex(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
