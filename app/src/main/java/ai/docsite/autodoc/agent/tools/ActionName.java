package ai.docsite.autodoc.agent.tools;

import java.util.Optional;

/**
 * Actions the reasoning engine may request. The wire name is what the engine sees.
 */
public enum ActionName {
    READ_FILE("read-file"),
    DIFF_COMMIT("diff-commit"),
    LIST_CHANGED_FILES("list-changed-files"),
    LIST_INTERNAL_DEPENDENCIES("list-internal-dependencies"),
    GET_HISTORY("get-history"),
    GET_PAGE("get-page"),
    FIND_PAGE_BY_TITLE("find-page-by-title"),
    CREATE_PAGE("create-page"),
    UPDATE_PAGE("update-page"),
    CONVERT_TO_MARKUP("convert-to-markup");

    private final String wireName;

    ActionName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Actions whose absence means nothing was published.
     */
    public boolean isPublishCritical() {
        return this == CONVERT_TO_MARKUP || this == CREATE_PAGE || this == UPDATE_PAGE;
    }

    public static Optional<ActionName> fromWireName(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        for (ActionName name : values()) {
            if (name.wireName.equals(trimmed)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
