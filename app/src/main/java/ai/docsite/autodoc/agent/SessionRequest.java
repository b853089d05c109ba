package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionRequest;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Parameters of one bounded engine conversation.
 *
 * @param argumentInterceptor applied to every decoded request before it executes
 * @param propagateActionFailures abort with {@link ActionFailedException} when a collaborator throws
 * @param recordListener receives each record as soon as the action has run
 */
public record SessionRequest(PhaseName phase,
                             String systemDirective,
                             String userDirective,
                             int budget,
                             boolean forceAction,
                             UnaryOperator<ActionRequest> argumentInterceptor,
                             boolean propagateActionFailures,
                             Consumer<ActionInvocationRecord> recordListener) {

    public SessionRequest {
        Objects.requireNonNull(phase, "phase");
        systemDirective = Objects.requireNonNullElse(systemDirective, "");
        userDirective = Objects.requireNonNullElse(userDirective, "");
        if (budget < 0) {
            throw new IllegalArgumentException("budget must not be negative");
        }
        argumentInterceptor = argumentInterceptor == null ? UnaryOperator.identity() : argumentInterceptor;
        recordListener = recordListener == null ? record -> { } : recordListener;
    }

    public static SessionRequest of(PhaseName phase, String systemDirective, String userDirective,
                                    int budget, boolean forceAction) {
        return new SessionRequest(phase, systemDirective, userDirective, budget, forceAction, null, false, null);
    }

    public SessionRequest withArgumentInterceptor(UnaryOperator<ActionRequest> interceptor) {
        return new SessionRequest(phase, systemDirective, userDirective, budget, forceAction,
                interceptor, propagateActionFailures, recordListener);
    }

    public SessionRequest withPropagatedActionFailures() {
        return new SessionRequest(phase, systemDirective, userDirective, budget, forceAction,
                argumentInterceptor, true, recordListener);
    }

    public SessionRequest withRecordListener(Consumer<ActionInvocationRecord> listener) {
        return new SessionRequest(phase, systemDirective, userDirective, budget, forceAction,
                argumentInterceptor, propagateActionFailures, listener);
    }
}
