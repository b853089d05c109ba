package ai.docsite.autodoc.agent;

/**
 * Which required-action table applies to a task.
 */
public enum PlanVariant {
    GENERATE,
    UPDATE_BY_PAGE_ID,
    UPDATE_BY_COMMIT
}
