package com.tableflow.tableflow_automation.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignerTest {

    private final WebhookSigner signer = new WebhookSigner(new ObjectMapper());

    @Test
    void canonicalJsonSortsKeysAtEveryLevel() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("z", 1);
        inner.put("a", 2);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("b", inner);
        payload.put("a", "x");

        String json = new String(signer.canonicalJson(payload), StandardCharsets.UTF_8);

        assertThat(json).isEqualTo("{\"a\":\"x\",\"b\":{\"a\":2,\"z\":1}}");
    }

    @Test
    void knownHmacVector() {
        // RFC 4231 test case 2
        String signature = signer.sign("what do ya want for nothing?".getBytes(StandardCharsets.UTF_8), "Jefe");

        assertThat(signature).isEqualTo("sha256=5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }

    @Test
    void verifyAcceptsPrefixedAndBareSignatures() {
        byte[] body = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
        String signature = signer.sign(body, "k");

        assertThat(signer.verify(body, "k", signature)).isTrue();
        assertThat(signer.verify(body, "k", signature.substring(WebhookSigner.SIGNATURE_PREFIX.length()))).isTrue();
        assertThat(signer.verify(body, "k", signature.toUpperCase())).isTrue();
    }

    @Test
    void verifyRejectsWrongSecretOrMissingSignature() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        String signature = signer.sign(body, "k");

        assertThat(signer.verify(body, "other", signature)).isFalse();
        assertThat(signer.verify(body, "k", null)).isFalse();
        assertThat(signer.verify(body, "", signature)).isFalse();
    }

    @Test
    void changingAnyByteOfASignedDeliveryBodyInvalidatesTheSignature() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "row.created");
        payload.put("row", Map.of("id", 42, "name", "Ada"));
        byte[] body = signer.canonicalJson(payload);
        String signature = signer.sign(body, "secret-1");

        assertThat(signer.verify(body, "secret-1", signature)).isTrue();
        for (int i = 0; i < body.length; i++) {
            byte[] tampered = body.clone();
            tampered[i] ^= 0x01;
            assertThat(signer.verify(tampered, "secret-1", signature))
                    .as("byte %d flipped", i)
                    .isFalse();
        }
    }
}
