package ai.docsite.autodoc.config;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Where documentation pages live. The API token is kept in {@link Secrets}.
 */
public record ConfluenceSettings(URI baseUrl, String email, Optional<String> spaceId, Optional<String> parentPageId) {

    public ConfluenceSettings {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be blank");
        }
        spaceId = spaceId == null ? Optional.empty() : spaceId.filter(value -> !value.isBlank());
        parentPageId = parentPageId == null ? Optional.empty() : parentPageId.filter(value -> !value.isBlank());
    }
}
