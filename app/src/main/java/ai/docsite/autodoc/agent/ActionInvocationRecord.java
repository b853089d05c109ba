package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionName;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One executed action, as seen by the gate and the outcome.
 */
public record ActionInvocationRecord(PhaseName phase,
                                     ActionName actionName,
                                     Map<String, Object> arguments,
                                     String result,
                                     boolean error) {

    public ActionInvocationRecord {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(actionName, "actionName");
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments == null ? Map.of() : arguments));
        result = Objects.requireNonNullElse(result, "");
    }
}
