package ai.docsite.autodoc.source;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Commit metadata as exposed to callers.
 */
public record CommitInfo(String id, String message, String authorName, String authorEmail,
                         Instant timestamp, List<String> files) {

    public CommitInfo {
        Objects.requireNonNull(id, "id");
        message = Objects.requireNonNullElse(message, "");
        files = List.copyOf(files == null ? List.of() : files);
    }
}
