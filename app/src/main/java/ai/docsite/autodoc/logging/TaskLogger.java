package ai.docsite.autodoc.logging;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Logger scoped to one documentation task. While open it tags every log line of the current thread with the
 * task id, the action kind and the active phase.
 */
public final class TaskLogger implements AutoCloseable {

    public static final String MDC_TASK_ID = "taskId";
    public static final String MDC_ACTION = "action";
    public static final String MDC_PHASE = "phase";

    private static final Logger LOGGER = LoggerFactory.getLogger("ai.docsite.autodoc.task");

    private final String taskId;
    private final String action;
    private final String previousTaskId;
    private final String previousAction;
    private final String previousPhase;

    private TaskLogger(String taskId, String action) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.action = Objects.requireNonNull(action, "action");
        this.previousTaskId = MDC.get(MDC_TASK_ID);
        this.previousAction = MDC.get(MDC_ACTION);
        this.previousPhase = MDC.get(MDC_PHASE);
        MDC.put(MDC_TASK_ID, taskId);
        MDC.put(MDC_ACTION, action);
        MDC.remove(MDC_PHASE);
    }

    public static TaskLogger open(String taskId, String action) {
        return new TaskLogger(taskId, action);
    }

    public String taskId() {
        return taskId;
    }

    public String action() {
        return action;
    }

    public void enterPhase(String phase) {
        MDC.put(MDC_PHASE, phase);
    }

    public void info(String format, Object... arguments) {
        LOGGER.info(format, arguments);
    }

    public void warn(String format, Object... arguments) {
        LOGGER.warn(format, arguments);
    }

    public void debug(String format, Object... arguments) {
        LOGGER.debug(format, arguments);
    }

    @Override
    public void close() {
        restore(MDC_TASK_ID, previousTaskId);
        restore(MDC_ACTION, previousAction);
        restore(MDC_PHASE, previousPhase);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
