package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Task-local, append-only log of what the engine did, plus the page facts it uncovered. Not thread-safe; one
 * instance per task.
 */
public class ExecutionState {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<ActionInvocationRecord> records = new ArrayList<>();
    private String latestText = "";
    private DiscoveredEntities discovered = DiscoveredEntities.none();

    public void record(ActionInvocationRecord record) {
        Objects.requireNonNull(record, "record");
        records.add(record);
        if (!record.error() && isPageLookup(record.actionName())) {
            discovered = discovered.mergedWith(pageFacts(record.result()));
        }
    }

    public List<ActionInvocationRecord> records() {
        return List.copyOf(records);
    }

    public List<ActionInvocationRecord> recordsFor(PhaseName phase) {
        return records.stream().filter(record -> record.phase() == phase).toList();
    }

    /**
     * Actions recorded in the phase, including calls that were rejected or whose collaborator failed.
     */
    public Set<ActionName> executed(PhaseName phase) {
        Set<ActionName> executed = EnumSet.noneOf(ActionName.class);
        recordsFor(phase).forEach(record -> executed.add(record.actionName()));
        return executed;
    }

    public String latestText() {
        return latestText;
    }

    public void updateLatestText(String text) {
        if (text != null && !text.isBlank()) {
            latestText = text;
        }
    }

    public DiscoveredEntities discovered() {
        return discovered;
    }

    /**
     * Most recent successful create-page or update-page call.
     */
    public Optional<ActionInvocationRecord> latestWrite() {
        for (int i = records.size() - 1; i >= 0; i--) {
            ActionInvocationRecord record = records.get(i);
            if (!record.error()
                    && (record.actionName() == ActionName.CREATE_PAGE || record.actionName() == ActionName.UPDATE_PAGE)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    private static boolean isPageLookup(ActionName name) {
        return name == ActionName.GET_PAGE || name == ActionName.FIND_PAGE_BY_TITLE;
    }

    static DiscoveredEntities pageFacts(String resultJson) {
        JsonNode node;
        try {
            node = MAPPER.readTree(resultJson);
        } catch (JsonProcessingException ex) {
            return DiscoveredEntities.none();
        }
        if (node == null || !node.isObject()) {
            return DiscoveredEntities.none();
        }
        Optional<String> pageId = text(node, "pageId");
        if (pageId.isEmpty()) {
            return DiscoveredEntities.none();
        }
        Optional<Integer> version = node.hasNonNull("version") && node.get("version").canConvertToInt()
                ? Optional.of(node.get("version").asInt())
                : Optional.empty();
        return new DiscoveredEntities(pageId, text(node, "title"), version);
    }

    static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
