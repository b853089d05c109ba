package ai.docsite.autodoc.task;

/**
 * Raised when a documentation task is missing required fields.
 */
public class InvalidTaskException extends RuntimeException {

    public InvalidTaskException(String message) {
        super(message);
    }
}
