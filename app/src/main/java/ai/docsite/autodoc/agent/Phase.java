package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionName;
import java.util.List;
import java.util.Objects;

/**
 * One stage of a documentation run.
 *
 * @param stepBudget maximum engine rounds for the phase
 * @param requiredActions actions that must have been executed once the phase (and its recovery) ends
 * @param forceAction whether the engine must request an action in its first round
 * @param promptContinuation whether the phase directive is seeded with the previous phase's text
 */
public record Phase(PhaseName name,
                    int stepBudget,
                    List<ActionName> requiredActions,
                    boolean forceAction,
                    boolean promptContinuation) {

    public Phase {
        Objects.requireNonNull(name, "name");
        if (stepBudget < 0) {
            throw new IllegalArgumentException("stepBudget must not be negative");
        }
        requiredActions = List.copyOf(requiredActions == null ? List.of() : requiredActions);
    }

    public boolean isGated() {
        return !requiredActions.isEmpty();
    }

    public int recoveryBudget() {
        return stepBudget / 2;
    }
}
