package ai.docsite.autodoc.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime settings for the reasoning engine provider.
 */
public record EngineConfig(LlmProvider provider,
                           String modelName,
                           Optional<String> baseUrl,
                           double temperature,
                           Duration timeout) {

    public EngineConfig {
        provider = Objects.requireNonNull(provider, "provider");
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0 and 2");
        }
        timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }
}
