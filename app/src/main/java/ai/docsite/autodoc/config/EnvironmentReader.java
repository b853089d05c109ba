package ai.docsite.autodoc.config;

import java.util.Optional;

/**
 * Source of configuration variables, usually the process environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value of {@code key}; blank values count as unset.
     */
    default Optional<String> value(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
