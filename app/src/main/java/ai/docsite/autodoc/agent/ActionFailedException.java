package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionName;

/**
 * A collaborator failed while publishing.
 */
public class ActionFailedException extends RuntimeException {

    private final ActionName actionName;

    public ActionFailedException(ActionName actionName, RuntimeException cause) {
        super("Action " + actionName + " failed: " + cause.getMessage(), cause);
        this.actionName = actionName;
    }

    public ActionName actionName() {
        return actionName;
    }
}
