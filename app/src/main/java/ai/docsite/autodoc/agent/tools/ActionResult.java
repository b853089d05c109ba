package ai.docsite.autodoc.agent.tools;

import java.util.Objects;
import java.util.Optional;

/**
 * Text returned to the engine for one action call. {@code failure} is present only when a collaborator
 * raised an exception, as opposed to the engine passing unusable arguments.
 */
public record ActionResult(String text, boolean error, Optional<RuntimeException> failure) {

    public ActionResult {
        text = Objects.requireNonNullElse(text, "");
        failure = failure == null ? Optional.empty() : failure;
    }

    public static ActionResult success(String text) {
        return new ActionResult(text, false, Optional.empty());
    }

    public static ActionResult rejected(String text) {
        return new ActionResult(text, true, Optional.empty());
    }

    public static ActionResult failed(String text, RuntimeException failure) {
        return new ActionResult(text, true, Optional.of(failure));
    }
}
