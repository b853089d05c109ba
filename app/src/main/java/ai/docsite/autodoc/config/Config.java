package ai.docsite.autodoc.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        EngineConfig engineConfig,
        ConfluenceSettings confluence,
        Path repositoryPath,
        String mainBranch,
        int maxSteps,
        int resultDigestChars,
        int historyLimit,
        Set<String> placeholderPageIds,
        Set<String> placeholderTitles,
        Set<String> placeholderVersions,
        boolean placeholderRetrievedTokens,
        int webhookParallelism,
        LogFormat logFormat,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(engineConfig, "engineConfig");
        Objects.requireNonNull(confluence, "confluence");
        Objects.requireNonNull(repositoryPath, "repositoryPath");
        if (mainBranch == null || mainBranch.isBlank()) {
            throw new IllegalArgumentException("mainBranch must not be blank");
        }
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1");
        }
        if (resultDigestChars < 1) {
            throw new IllegalArgumentException("resultDigestChars must be positive");
        }
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive");
        }
        placeholderPageIds = Set.copyOf(Objects.requireNonNull(placeholderPageIds, "placeholderPageIds"));
        placeholderTitles = Set.copyOf(Objects.requireNonNull(placeholderTitles, "placeholderTitles"));
        placeholderVersions = Set.copyOf(Objects.requireNonNull(placeholderVersions, "placeholderVersions"));
        if (webhookParallelism < 1) {
            throw new IllegalArgumentException("webhookParallelism must be at least 1");
        }
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(secrets, "secrets");
    }
}
