package ai.docsite.autodoc.page;

import java.util.Optional;

/**
 * Remote store holding documentation pages.
 */
public interface PageStore {

    /**
     * @return identifier of the created page
     */
    String createPage(String spaceId, String title, String content, Optional<String> parentId);

    /**
     * Replaces the page body. {@code version} is the version the caller read; the store records {@code version + 1}.
     *
     * @return identifier of the updated page
     * @throws PageNotFoundException when the page does not exist
     * @throws VersionConflictException when {@code version} is stale
     */
    String updatePage(String pageId, String title, String content, int version);

    Page getPage(String pageId);

    /**
     * Looks up a current page whose title matches exactly.
     */
    Optional<String> findPageByTitle(String spaceId, String title);
}
