package ai.docsite.autodoc.page;

/**
 * Runtime exception for failures talking to the page store.
 */
public class PageStoreException extends RuntimeException {

    public PageStoreException(String message) {
        super(message);
    }

    public PageStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
