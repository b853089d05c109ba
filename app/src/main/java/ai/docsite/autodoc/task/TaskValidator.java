package ai.docsite.autodoc.task;

import ai.docsite.autodoc.source.CommitReferences;

/**
 * Rejects malformed tasks before any collaborator is contacted.
 */
public class TaskValidator {

    public void validate(DocumentationTask task) {
        if (task == null) {
            throw new InvalidTaskException("task must not be null");
        }
        if (task.spaceId().isBlank()) {
            throw new InvalidTaskException("spaceId is required");
        }
        switch (task.actionKind()) {
            case GENERATE -> {
                if (task.filePath().isEmpty()) {
                    throw new InvalidTaskException("filePath is required to generate documentation");
                }
            }
            case UPDATE -> {
                if (task.commitId().isEmpty() && task.pageId().isEmpty()) {
                    throw new InvalidTaskException("commitId or pageId is required to update documentation");
                }
            }
        }
        task.commitId().ifPresent(CommitReferences::requireValid);
    }
}
