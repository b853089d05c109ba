package ai.docsite.autodoc.task;

/**
 * Kind of documentation work requested for a task.
 */
public enum ActionKind {
    GENERATE,
    UPDATE;

    public static ActionKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Action must be provided");
        }
        for (ActionKind kind : values()) {
            if (kind.name().equalsIgnoreCase(raw.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported action: " + raw);
    }

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
