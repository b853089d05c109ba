package ai.docsite.autodoc.agent.tools;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed catalogue of actions offered to the engine, with their argument schemas.
 */
public final class ActionRegistry {

    private final Map<ActionName, ToolSpecification> specifications = new EnumMap<>(ActionName.class);

    public ActionRegistry() {
        for (ActionName name : ActionName.values()) {
            specifications.put(name, ToolSpecification.builder()
                    .name(name.wireName())
                    .description(describe(name))
                    .parameters(schema(name))
                    .build());
        }
    }

    public List<ToolSpecification> specifications() {
        return Arrays.stream(ActionName.values()).map(specifications::get).toList();
    }

    public ToolSpecification specification(ActionName name) {
        return specifications.get(name);
    }

    private static String describe(ActionName name) {
        return switch (name) {
            case READ_FILE -> "Read the content of a source file, optionally at a specific commit";
            case DIFF_COMMIT -> "Get the unified diff and changed files of a commit";
            case LIST_CHANGED_FILES -> "List the documentable source files changed by a commit";
            case LIST_INTERNAL_DEPENDENCIES -> "List all internal (non third-party) dependencies of a file, recursively";
            case GET_HISTORY -> "Get the history of business logic changes for a file";
            case GET_PAGE -> "Get a documentation page by id, including its title, version and content";
            case FIND_PAGE_BY_TITLE -> "Find a documentation page by its exact title in a space";
            case CREATE_PAGE -> "Create a new documentation page from converted markup";
            case UPDATE_PAGE -> "Update an existing documentation page with converted markup";
            case CONVERT_TO_MARKUP -> "Convert markdown documentation into the page storage format";
        };
    }

    private static JsonObjectSchema schema(ActionName name) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        switch (name) {
            case READ_FILE -> builder
                    .addStringProperty("path", "Repository-relative path of the file")
                    .addStringProperty("revision", "Optional commit id to read the file at")
                    .required("path");
            case DIFF_COMMIT, LIST_CHANGED_FILES -> builder
                    .addStringProperty("commitId", "Commit hash")
                    .required("commitId");
            case LIST_INTERNAL_DEPENDENCIES -> builder
                    .addStringProperty("path", "Repository-relative path of the file")
                    .required("path");
            case GET_HISTORY -> builder
                    .addStringProperty("path", "Repository-relative path of the file")
                    .addIntegerProperty("limit", "Maximum number of commits to return (default 10)")
                    .required("path");
            case GET_PAGE -> builder
                    .addStringProperty("pageId", "Page id")
                    .required("pageId");
            case FIND_PAGE_BY_TITLE -> builder
                    .addStringProperty("spaceId", "Space id")
                    .addStringProperty("title", "Exact page title to search for")
                    .required("spaceId", "title");
            case CREATE_PAGE -> builder
                    .addStringProperty("spaceId", "Space id")
                    .addStringProperty("title", "Page title")
                    .addStringProperty("content", "Page content in storage format, as returned by convert-to-markup")
                    .addStringProperty("parentId", "Optional parent page id")
                    .required("spaceId", "title", "content");
            case UPDATE_PAGE -> builder
                    .addStringProperty("pageId", "Id of the page to update, as returned by get-page or find-page-by-title")
                    .addStringProperty("title", "Page title")
                    .addStringProperty("content", "Page content in storage format, as returned by convert-to-markup")
                    .addIntegerProperty("version", "Current version number of the page")
                    .required("pageId", "title", "content", "version");
            case CONVERT_TO_MARKUP -> builder
                    .addStringProperty("markdown", "Markdown documentation")
                    .required("markdown");
        }
        return builder.build();
    }
}
