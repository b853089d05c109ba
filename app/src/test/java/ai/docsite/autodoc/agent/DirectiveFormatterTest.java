package ai.docsite.autodoc.agent;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.autodoc.agent.tools.ActionName;
import ai.docsite.autodoc.task.DocumentationTask;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DirectiveFormatterTest {

    private final DirectiveFormatter formatter = new DirectiveFormatter(15, 20);

    @Test
    void generateRetrievalNamesFileAndHistoryLimit() {
        DocumentationTask task = DocumentationTask.generate("DOCS", "src/lib/date-utils.ts", null);

        String directive = formatter.retrieval(task, PlanVariant.GENERATE);

        assertThat(directive)
                .contains("read-file with path=\"src/lib/date-utils.ts\"")
                .contains("list-internal-dependencies")
                .contains("limit=15");
    }

    @Test
    void updateWithoutCommitAsksForLatestCommit() {
        DocumentationTask task = DocumentationTask.update("DOCS", null, "42", null);

        String directive = formatter.retrieval(task, PlanVariant.UPDATE_BY_PAGE_ID);

        assertThat(directive).contains("get-page with pageId=\"42\"").contains("get-history");
    }

    @Test
    void updateByCommitSuggestsDerivedTitle() {
        DocumentationTask task = DocumentationTask.update("DOCS", "abc1234", null, null);

        assertThat(formatter.retrieval(task, PlanVariant.UPDATE_BY_COMMIT))
                .contains("diff-commit with commitId=\"abc1234\"")
                .contains("\"Date Utils Documentation\"");
    }

    @Test
    void publishDirectiveForGenerateIncludesTitleAndParent() {
        DocumentationTask task = DocumentationTask.generate("DOCS", "src/api-client.ts", "100");

        String directive = formatter.publish(task, "# Api", List.of(ActionName.CONVERT_TO_MARKUP, ActionName.CREATE_PAGE),
                DiscoveredEntities.none());

        assertThat(directive)
                .contains("title=\"Api Client Documentation\"")
                .contains("parentId=\"100\"")
                .endsWith("Required actions: convert-to-markup, create-page.")
                .doesNotContain("EXACT values");
    }

    @Test
    void digestSkipsBulkyArgumentsAndTruncatesResults() {
        ActionInvocationRecord record = new ActionInvocationRecord(PhaseName.PUBLISH, ActionName.CONVERT_TO_MARKUP,
                Map.of("markdown", "# very long"), "{\"markup\":\"<h1>very long</h1>\"}", false);

        String digest = formatter.digest(List.of(record));

        assertThat(digest)
                .startsWith("- convert-to-markup ()")
                .doesNotContain("# very long")
                .endsWith("... [truncated]");
    }

    @Test
    void recoveryListsMissingActionsAndRepeatsInstructions() {
        String directive = formatter.recovery("", "Original steps", List.of(ActionName.GET_PAGE, ActionName.DIFF_COMMIT));

        assertThat(directive)
                .startsWith("The following required actions were NOT executed: get-page, diff-commit.")
                .endsWith("Original instructions:\nOriginal steps");
    }

    @Test
    void publishDirectiveRepeatsDiscoveredValues() {
        DocumentationTask task = DocumentationTask.update("DOCS", "abc1234", null, null);
        DiscoveredEntities discovered = new DiscoveredEntities(Optional.of("42"), Optional.empty(), Optional.of(3));

        assertThat(formatter.publish(task, "", List.of(ActionName.UPDATE_PAGE), discovered))
                .contains("(none yet, write it now)")
                .contains("Use these EXACT values: pageId=\"42\", version=3.");
    }
}
