package ai.docsite.autodoc.task;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable request to generate or update the documentation page of a source file.
 */
public record DocumentationTask(String taskId,
                                ActionKind actionKind,
                                String spaceId,
                                Optional<String> filePath,
                                Optional<String> commitId,
                                Optional<String> pageId,
                                Optional<String> parentPageId) {

    public DocumentationTask {
        taskId = taskId == null || taskId.isBlank() ? UUID.randomUUID().toString().substring(0, 8) : taskId;
        Objects.requireNonNull(actionKind, "actionKind");
        spaceId = spaceId == null ? "" : spaceId.trim();
        filePath = normalize(filePath);
        commitId = commitId == null ? Optional.empty() : commitId;
        pageId = normalize(pageId);
        parentPageId = normalize(parentPageId);
    }

    public static DocumentationTask generate(String spaceId, String filePath, String parentPageId) {
        return new DocumentationTask(null, ActionKind.GENERATE, spaceId, Optional.ofNullable(filePath),
                Optional.empty(), Optional.empty(), Optional.ofNullable(parentPageId));
    }

    public static DocumentationTask update(String spaceId, String commitId, String pageId, String parentPageId) {
        return new DocumentationTask(null, ActionKind.UPDATE, spaceId, Optional.empty(),
                Optional.ofNullable(commitId), Optional.ofNullable(pageId), Optional.ofNullable(parentPageId));
    }

    public boolean isGenerate() {
        return actionKind == ActionKind.GENERATE;
    }

    public boolean hasKnownPage() {
        return pageId.isPresent();
    }

    private static Optional<String> normalize(Optional<String> value) {
        if (value == null) {
            return Optional.empty();
        }
        return value.map(String::trim).filter(v -> !v.isEmpty());
    }
}
