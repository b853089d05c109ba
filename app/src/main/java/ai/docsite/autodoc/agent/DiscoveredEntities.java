package ai.docsite.autodoc.agent;

import java.util.Optional;

/**
 * Page facts learned from successful page lookups during a run.
 */
public record DiscoveredEntities(Optional<String> pageId, Optional<String> pageTitle, Optional<Integer> pageVersion) {

    public DiscoveredEntities {
        pageId = pageId == null ? Optional.empty() : pageId;
        pageTitle = pageTitle == null ? Optional.empty() : pageTitle;
        pageVersion = pageVersion == null ? Optional.empty() : pageVersion;
    }

    public static DiscoveredEntities none() {
        return new DiscoveredEntities(Optional.empty(), Optional.empty(), Optional.empty());
    }

    public boolean hasPage() {
        return pageId.isPresent();
    }

    /**
     * Newer facts win; absent facts never erase known ones. A different page replaces everything known.
     */
    public DiscoveredEntities mergedWith(DiscoveredEntities newer) {
        if (newer.pageId.isPresent() && pageId.isPresent() && !newer.pageId.equals(pageId)) {
            return newer;
        }
        return new DiscoveredEntities(
                newer.pageId.or(() -> pageId),
                newer.pageTitle.or(() -> pageTitle),
                newer.pageVersion.or(() -> pageVersion));
    }
}
