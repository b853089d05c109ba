package ai.docsite.autodoc.agent;

import static ai.docsite.autodoc.agent.tools.ActionName.CONVERT_TO_MARKUP;
import static ai.docsite.autodoc.agent.tools.ActionName.CREATE_PAGE;
import static ai.docsite.autodoc.agent.tools.ActionName.DIFF_COMMIT;
import static ai.docsite.autodoc.agent.tools.ActionName.FIND_PAGE_BY_TITLE;
import static ai.docsite.autodoc.agent.tools.ActionName.GET_HISTORY;
import static ai.docsite.autodoc.agent.tools.ActionName.GET_PAGE;
import static ai.docsite.autodoc.agent.tools.ActionName.LIST_INTERNAL_DEPENDENCIES;
import static ai.docsite.autodoc.agent.tools.ActionName.READ_FILE;
import static ai.docsite.autodoc.agent.tools.ActionName.UPDATE_PAGE;

import ai.docsite.autodoc.agent.tools.ActionName;
import ai.docsite.autodoc.task.DocumentationTask;
import java.util.List;
import java.util.Objects;

/**
 * Splits the total step budget into retrieval, analysis and publish phases and attaches the required actions
 * for the task's variant. Shares are 40/20/40 percent, each rounded down.
 */
public class PhasePlanner {

    public static final int DEFAULT_TOTAL_BUDGET = 10;

    private final int totalBudget;

    public PhasePlanner() {
        this(DEFAULT_TOTAL_BUDGET);
    }

    public PhasePlanner(int totalBudget) {
        if (totalBudget < 1) {
            throw new IllegalArgumentException("totalBudget must be at least 1");
        }
        this.totalBudget = totalBudget;
    }

    public int totalBudget() {
        return totalBudget;
    }

    public PhasePlan plan(DocumentationTask task) {
        Objects.requireNonNull(task, "task");
        PlanVariant variant = variantOf(task);
        int retrievalBudget = share(4);
        int analysisBudget = share(2);
        int publishBudget = share(4);
        return new PhasePlan(variant, List.of(
                new Phase(PhaseName.RETRIEVAL, retrievalBudget, retrievalRequirements(variant), true, false),
                new Phase(PhaseName.ANALYSIS, analysisBudget, List.of(), false, true),
                new Phase(PhaseName.PUBLISH, publishBudget, publishRequirements(variant), true, true)));
    }

    private int share(int tenths) {
        return (int) ((long) totalBudget * tenths / 10);
    }

    static PlanVariant variantOf(DocumentationTask task) {
        if (task.isGenerate()) {
            return PlanVariant.GENERATE;
        }
        return task.hasKnownPage() ? PlanVariant.UPDATE_BY_PAGE_ID : PlanVariant.UPDATE_BY_COMMIT;
    }

    private static List<ActionName> retrievalRequirements(PlanVariant variant) {
        return switch (variant) {
            case GENERATE -> List.of(READ_FILE, LIST_INTERNAL_DEPENDENCIES, GET_HISTORY);
            case UPDATE_BY_PAGE_ID -> List.of(GET_PAGE, DIFF_COMMIT);
            case UPDATE_BY_COMMIT -> List.of(DIFF_COMMIT, FIND_PAGE_BY_TITLE);
        };
    }

    private static List<ActionName> publishRequirements(PlanVariant variant) {
        return switch (variant) {
            case GENERATE -> List.of(CONVERT_TO_MARKUP, CREATE_PAGE);
            case UPDATE_BY_PAGE_ID, UPDATE_BY_COMMIT -> List.of(CONVERT_TO_MARKUP, UPDATE_PAGE);
        };
    }
}
