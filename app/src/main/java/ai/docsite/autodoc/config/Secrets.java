package ai.docsite.autodoc.config;

import java.util.Optional;

/**
 * Holds credentials for external integrations.
 */
public record Secrets(Optional<String> openAiApiKey,
                      Optional<String> geminiApiKey,
                      String confluenceApiToken,
                      Optional<String> webhookSecret) {

    public Secrets {
        openAiApiKey = openAiApiKey == null ? Optional.empty() : openAiApiKey;
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
        if (confluenceApiToken == null || confluenceApiToken.isBlank()) {
            throw new IllegalArgumentException("confluenceApiToken must not be blank");
        }
        webhookSecret = webhookSecret == null ? Optional.empty() : webhookSecret;
    }

    @Override
    public String toString() {
        return "Secrets[openAiApiKey=" + mask(openAiApiKey) + ", geminiApiKey=" + mask(geminiApiKey)
                + ", confluenceApiToken=***, webhookSecret=" + mask(webhookSecret) + "]";
    }

    private static String mask(Optional<String> value) {
        return value.isPresent() ? "***" : "<unset>";
    }
}
