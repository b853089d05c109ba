package ai.docsite.autodoc.task;

import ai.docsite.autodoc.agent.tools.ActionName;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one documentation task, produced once when the run finishes.
 */
public record Outcome(boolean success,
                      boolean partial,
                      OutcomeStatus status,
                      List<ActionName> missingActions,
                      Optional<String> pageId,
                      Optional<String> pageTitle,
                      String message) {

    public Outcome {
        Objects.requireNonNull(status, "status");
        missingActions = List.copyOf(missingActions == null ? List.of() : missingActions);
        pageId = pageId == null ? Optional.empty() : pageId;
        pageTitle = pageTitle == null ? Optional.empty() : pageTitle;
        message = Objects.requireNonNullElse(message, "");
    }

    public static Outcome completed(Optional<String> pageId, Optional<String> pageTitle, String message) {
        return new Outcome(true, false, OutcomeStatus.COMPLETED, List.of(), pageId, pageTitle, message);
    }
}
