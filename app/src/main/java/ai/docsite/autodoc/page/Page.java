package ai.docsite.autodoc.page;

import java.util.Objects;

/**
 * Snapshot of a stored documentation page.
 */
public record Page(String id, String title, int version, String content) {

    public Page {
        Objects.requireNonNull(id, "id");
        title = Objects.requireNonNullElse(title, "");
        content = Objects.requireNonNullElse(content, "");
    }
}
