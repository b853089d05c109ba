package ai.docsite.autodoc.agent.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One action call requested by the engine, with its decoded arguments.
 */
public record ActionRequest(String id, ActionName name, Map<String, Object> arguments) {

    public ActionRequest {
        id = Objects.requireNonNullElse(id, "");
        Objects.requireNonNull(name, "name");
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments == null ? Map.of() : arguments));
    }

    public Optional<Object> argument(String key) {
        return Optional.ofNullable(arguments.get(key));
    }

    public ActionRequest withArguments(Map<String, Object> replacement) {
        return new ActionRequest(id, name, replacement);
    }
}
