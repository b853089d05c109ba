package ai.docsite.autodoc.webhook;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WebhookSignatureVerifierTest {

    private static final byte[] BODY = "{\"ref\":\"refs/heads/main\"}".getBytes(StandardCharsets.UTF_8);

    @Test
    void acceptsMatchingSignature() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(Optional.of("It's a Secret to Everybody"));

        // published example pair for HMAC-SHA256 push signatures
        byte[] body = "Hello, World!".getBytes(StandardCharsets.UTF_8);
        assertThat(verifier.verify(body,
                "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17")).isTrue();
    }

    @Test
    void rejectsTamperedBody() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(Optional.of("secret"));
        String signature = verifier.sign(BODY);

        assertThat(verifier.verify(BODY, signature)).isTrue();
        assertThat(verifier.verify("{}".getBytes(StandardCharsets.UTF_8), signature)).isFalse();
        assertThat(verifier.verify(BODY, "sha256=deadbeef")).isFalse();
    }

    @Test
    void skipsVerificationWithoutSecretOrHeader() {
        assertThat(new WebhookSignatureVerifier(Optional.empty()).verify(BODY, "sha256=anything")).isTrue();
        assertThat(new WebhookSignatureVerifier(Optional.of("secret")).verify(BODY, null)).isTrue();
    }
}
