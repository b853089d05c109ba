package ai.docsite.autodoc.agent.tools;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import java.util.List;
import org.junit.jupiter.api.Test;

class ActionRegistryTest {

    private final ActionRegistry registry = new ActionRegistry();

    @Test
    void offersEveryActionUnderItsWireName() {
        List<String> names = registry.specifications().stream().map(ToolSpecification::name).toList();

        assertThat(names).containsExactly("read-file", "diff-commit", "list-changed-files",
                "list-internal-dependencies", "get-history", "get-page", "find-page-by-title", "create-page",
                "update-page", "convert-to-markup");
    }

    @Test
    void updatePageRequiresEveryField() {
        ToolSpecification update = registry.specification(ActionName.UPDATE_PAGE);

        assertThat(update.parameters().required()).containsExactly("pageId", "title", "content", "version");
        assertThat(update.parameters().properties().get("version")).isInstanceOf(JsonIntegerSchema.class);
    }

    @Test
    void optionalArgumentsAreNotRequired() {
        assertThat(registry.specification(ActionName.CREATE_PAGE).parameters().required())
                .containsExactly("spaceId", "title", "content");
        assertThat(registry.specification(ActionName.READ_FILE).parameters().required()).containsExactly("path");
        assertThat(registry.specification(ActionName.GET_HISTORY).parameters().properties()).containsKey("limit");
    }

    @Test
    void wireNamesRoundTripThroughLookup() {
        assertThat(ActionName.fromWireName(" update-page ")).contains(ActionName.UPDATE_PAGE);
        assertThat(ActionName.fromWireName("update_page")).isEmpty();
        assertThat(ActionName.fromWireName(null)).isEmpty();
    }
}
