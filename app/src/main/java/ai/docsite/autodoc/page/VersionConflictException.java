package ai.docsite.autodoc.page;

/**
 * Raised when an update was based on a stale page version.
 */
public class VersionConflictException extends PageStoreException {

    public VersionConflictException(String pageId, int version) {
        super("Version conflict updating page " + pageId + " from version " + version);
    }
}
