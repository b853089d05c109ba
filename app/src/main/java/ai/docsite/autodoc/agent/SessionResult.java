package ai.docsite.autodoc.agent;

import java.util.List;
import java.util.Objects;

/**
 * Final text of a session and the actions it executed, in order.
 */
public record SessionResult(String text, List<ActionInvocationRecord> records, int rounds) {

    public SessionResult {
        text = Objects.requireNonNullElse(text, "");
        records = List.copyOf(records == null ? List.of() : records);
    }

    public static SessionResult empty() {
        return new SessionResult("", List.of(), 0);
    }
}
