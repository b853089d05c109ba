package ai.docsite.autodoc.source;

import java.util.Objects;

/**
 * One commit in the history of a file, annotated with a business-logic classification.
 */
public record HistoryEntry(String id, String message, String author, String date,
                           boolean logicChange, String description) {

    public HistoryEntry {
        Objects.requireNonNull(id, "id");
        message = Objects.requireNonNullElse(message, "");
        author = Objects.requireNonNullElse(author, "");
        date = Objects.requireNonNullElse(date, "");
        description = Objects.requireNonNullElse(description, "");
    }
}
