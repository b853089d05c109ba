package ai.docsite.autodoc.webhook;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the {@code X-Hub-Signature-256} header of a push delivery.
 */
public class WebhookSignatureVerifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String ALGORITHM = "HmacSHA256";
    static final String PREFIX = "sha256=";

    private final Optional<String> secret;

    public WebhookSignatureVerifier(Optional<String> secret) {
        this.secret = secret == null ? Optional.empty() : secret.filter(value -> !value.isBlank());
    }

    /**
     * Returns {@code false} only when both a secret and a header are present and they disagree.
     */
    public boolean verify(byte[] body, String signatureHeader) {
        if (secret.isEmpty() || signatureHeader == null || signatureHeader.isBlank()) {
            LOGGER.warn("Skipping webhook signature verification: {}",
                    secret.isEmpty() ? "no secret configured" : "no signature header");
            return true;
        }
        String expected = sign(body);
        byte[] provided = signatureHeader.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), provided);
    }

    String sign(byte[] body) {
        String key = secret.orElseThrow(() -> new IllegalStateException("No webhook secret configured"));
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return PREFIX + HexFormat.of().formatHex(mac.doFinal(body));
        } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
            throw new IllegalStateException("Unable to compute webhook signature", ex);
        }
    }
}
