package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionName;
import ai.docsite.autodoc.agent.tools.ActionRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Replaces placeholder page identifiers in {@code update-page} requests with the page facts discovered earlier in
 * the run. Repairing an already repaired request returns it unchanged.
 */
public class ArgumentRepair {

    static final String DEFAULT_TITLE = "Documentation";

    private final PlaceholderPolicy policy;

    public ArgumentRepair() {
        this(PlaceholderPolicy.defaults());
    }

    public ArgumentRepair(PlaceholderPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public ActionRequest repair(ActionRequest request, DiscoveredEntities discovered) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(discovered, "discovered");
        if (request.name() != ActionName.UPDATE_PAGE || discovered.pageId().isEmpty()) {
            return request;
        }
        Object pageId = request.arguments().get("pageId");
        if (!policy.isPageIdPlaceholder(pageId)) {
            return request;
        }
        Map<String, Object> repaired = new LinkedHashMap<>(request.arguments());
        repaired.put("pageId", discovered.pageId().get());
        Object title = repaired.get("title");
        if (title == null || String.valueOf(title).isBlank() || policy.isTitlePlaceholder(title)) {
            repaired.put("title", discovered.pageTitle().orElse(DEFAULT_TITLE));
        }
        Object version = repaired.get("version");
        if (discovered.pageVersion().isPresent() && (version == null || policy.isVersionPlaceholder(version))) {
            repaired.put("version", discovered.pageVersion().get());
        }
        return request.withArguments(repaired);
    }
}
