package ai.docsite.autodoc.task;

/**
 * Terminal classification of a documentation run.
 */
public enum OutcomeStatus {
    COMPLETED,
    PARTIAL_COMPLETION,
    INCOMPLETE_UPDATE
}
