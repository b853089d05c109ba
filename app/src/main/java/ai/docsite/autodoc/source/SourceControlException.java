package ai.docsite.autodoc.source;

/**
 * Runtime exception for source repository failures.
 */
public class SourceControlException extends RuntimeException {

    public SourceControlException(String message) {
        super(message);
    }

    public SourceControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
