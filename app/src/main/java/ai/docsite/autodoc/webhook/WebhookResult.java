package ai.docsite.autodoc.webhook;

import ai.docsite.autodoc.task.Outcome;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary of one processed push delivery.
 */
public record WebhookResult(Status status, String message, List<CommitResult> commits) {

    public enum Status {
        PROCESSED,
        IGNORED,
        REJECTED
    }

    public WebhookResult {
        Objects.requireNonNull(status, "status");
        message = Objects.requireNonNullElse(message, "");
        commits = List.copyOf(commits == null ? List.of() : commits);
    }

    static WebhookResult ignored(String message) {
        return new WebhookResult(Status.IGNORED, message, List.of());
    }

    static WebhookResult rejected(String message) {
        return new WebhookResult(Status.REJECTED, message, List.of());
    }

    public boolean allSucceeded() {
        return status != Status.REJECTED
                && commits.stream().allMatch(commit -> commit.outcome().map(Outcome::success).orElse(false));
    }

    /**
     * Either an outcome or an error, never both.
     */
    public record CommitResult(String commitId, Optional<Outcome> outcome, Optional<String> error) {

        public static CommitResult of(String commitId, Outcome outcome) {
            return new CommitResult(commitId, Optional.of(outcome), Optional.empty());
        }

        public static CommitResult failed(String commitId, String error) {
            return new CommitResult(commitId, Optional.empty(), Optional.of(error));
        }
    }
}
