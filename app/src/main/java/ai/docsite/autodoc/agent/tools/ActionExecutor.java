package ai.docsite.autodoc.agent.tools;

import ai.docsite.autodoc.markup.MarkupConverter;
import ai.docsite.autodoc.page.Page;
import ai.docsite.autodoc.page.PageStore;
import ai.docsite.autodoc.source.DiffInfo;
import ai.docsite.autodoc.source.SourceReader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds each action to its collaborator call and renders the outcome as JSON text for the engine.
 */
public class ActionExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActionExecutor.class);
    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };
    static final int DEFAULT_HISTORY_LIMIT = 10;

    private final SourceReader sourceReader;
    private final PageStore pageStore;
    private final MarkupConverter markupConverter;
    private final ObjectMapper objectMapper;

    public ActionExecutor(SourceReader sourceReader, PageStore pageStore, MarkupConverter markupConverter) {
        this(sourceReader, pageStore, markupConverter, new ObjectMapper());
    }

    public ActionExecutor(SourceReader sourceReader,
                          PageStore pageStore,
                          MarkupConverter markupConverter,
                          ObjectMapper objectMapper) {
        this.sourceReader = Objects.requireNonNull(sourceReader, "sourceReader");
        this.pageStore = Objects.requireNonNull(pageStore, "pageStore");
        this.markupConverter = Objects.requireNonNull(markupConverter, "markupConverter");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Decodes the JSON argument object sent by the engine.
     *
     * @throws IllegalArgumentException when the arguments are not a JSON object
     */
    public Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, ARGUMENTS_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Arguments are not a JSON object: " + ex.getOriginalMessage(), ex);
        }
    }

    public ActionResult execute(ActionRequest request) {
        Objects.requireNonNull(request, "request");
        Map<String, Object> payload;
        try {
            payload = prepare(request);
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("Rejected {} call: {}", request.name(), ex.getMessage());
            return ActionResult.rejected(error(ex.getMessage()));
        }
        try {
            Map<String, Object> result = invoke(request, payload);
            return ActionResult.success(write(result));
        } catch (RuntimeException ex) {
            LOGGER.warn("Action {} failed: {}", request.name(), ex.getMessage());
            return ActionResult.failed(error(request.name() + " failed: " + ex.getMessage()), ex);
        }
    }

    // argument validation only; no collaborator is touched here
    private Map<String, Object> prepare(ActionRequest request) {
        Map<String, Object> args = new LinkedHashMap<>();
        switch (request.name()) {
            case READ_FILE -> {
                args.put("path", requireString(request, "path"));
                args.put("revision", optionalString(request, "revision"));
            }
            case DIFF_COMMIT, LIST_CHANGED_FILES -> args.put("commitId", requireString(request, "commitId"));
            case LIST_INTERNAL_DEPENDENCIES -> args.put("path", requireString(request, "path"));
            case GET_HISTORY -> {
                args.put("path", requireString(request, "path"));
                args.put("limit", optionalInteger(request, "limit").orElse(DEFAULT_HISTORY_LIMIT));
            }
            case GET_PAGE -> args.put("pageId", requireString(request, "pageId"));
            case FIND_PAGE_BY_TITLE -> {
                args.put("spaceId", requireString(request, "spaceId"));
                args.put("title", requireString(request, "title"));
            }
            case CREATE_PAGE -> {
                args.put("spaceId", requireString(request, "spaceId"));
                args.put("title", requireString(request, "title"));
                args.put("content", requireString(request, "content"));
                args.put("parentId", optionalString(request, "parentId"));
            }
            case UPDATE_PAGE -> {
                args.put("pageId", requireString(request, "pageId"));
                args.put("title", requireString(request, "title"));
                args.put("content", requireString(request, "content"));
                args.put("version", optionalInteger(request, "version")
                        .orElseThrow(() -> new IllegalArgumentException("Missing required argument: version")));
            }
            case CONVERT_TO_MARKUP -> args.put("markdown", requireString(request, "markdown"));
        }
        return args;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> invoke(ActionRequest request, Map<String, Object> args) {
        Map<String, Object> result = new LinkedHashMap<>();
        switch (request.name()) {
            case READ_FILE -> {
                String path = (String) args.get("path");
                result.put("path", path);
                result.put("content", sourceReader.readFile(path, (Optional<String>) args.get("revision")));
            }
            case DIFF_COMMIT -> {
                DiffInfo diff = sourceReader.diff((String) args.get("commitId"));
                result.put("commitId", diff.commitId());
                result.put("changedFiles", diff.changedFiles());
                result.put("patch", diff.patchText());
            }
            case LIST_CHANGED_FILES -> {
                String commitId = (String) args.get("commitId");
                result.put("commitId", commitId);
                result.put("files", sourceReader.listChangedFiles(commitId));
            }
            case LIST_INTERNAL_DEPENDENCIES -> {
                String path = (String) args.get("path");
                result.put("path", path);
                result.put("dependencies", sourceReader.listInternalDependencies(path));
            }
            case GET_HISTORY -> {
                String path = (String) args.get("path");
                result.put("path", path);
                result.put("commits", sourceReader.getHistory(path, (Integer) args.get("limit")));
            }
            case GET_PAGE -> putPage(result, pageStore.getPage((String) args.get("pageId")));
            case FIND_PAGE_BY_TITLE -> {
                Optional<String> pageId = pageStore.findPageByTitle((String) args.get("spaceId"), (String) args.get("title"));
                result.put("found", pageId.isPresent());
                pageId.ifPresent(id -> putPage(result, pageStore.getPage(id)));
            }
            case CREATE_PAGE -> {
                String title = (String) args.get("title");
                String pageId = pageStore.createPage((String) args.get("spaceId"), title,
                        (String) args.get("content"), (Optional<String>) args.get("parentId"));
                result.put("pageId", pageId);
                result.put("title", title);
            }
            case UPDATE_PAGE -> {
                String title = (String) args.get("title");
                int version = (Integer) args.get("version");
                String pageId = pageStore.updatePage((String) args.get("pageId"), title,
                        (String) args.get("content"), version);
                result.put("pageId", pageId);
                result.put("title", title);
                result.put("version", version + 1);
            }
            case CONVERT_TO_MARKUP -> result.put("markup", markupConverter.toMarkup((String) args.get("markdown")));
        }
        return result;
    }

    private static void putPage(Map<String, Object> result, Page page) {
        result.put("pageId", page.id());
        result.put("title", page.title());
        result.put("version", page.version());
        result.put("content", page.content());
    }

    private static String requireString(ActionRequest request, String key) {
        return optionalString(request, key)
                .orElseThrow(() -> new IllegalArgumentException("Missing required argument: " + key));
    }

    private static Optional<String> optionalString(ActionRequest request, String key) {
        return request.argument(key)
                .map(value -> value instanceof String text ? text : String.valueOf(value))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    private static Optional<Integer> optionalInteger(ActionRequest request, String key) {
        Optional<Object> value = request.argument(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Object raw = value.get();
        if (raw instanceof Number number) {
            return Optional.of(number.intValue());
        }
        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(text));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Argument " + key + " must be an integer but was \"" + text + "\"");
        }
    }

    private String error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", Objects.requireNonNullElse(message, "unknown error"));
        return write(body);
    }

    private String write(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize action result", ex);
        }
    }
}
