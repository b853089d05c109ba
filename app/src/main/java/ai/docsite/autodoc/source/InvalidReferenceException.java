package ai.docsite.autodoc.source;

/**
 * Raised when a commit identifier is blank, a placeholder, or not shaped like a revision hash.
 */
public class InvalidReferenceException extends SourceControlException {

    public InvalidReferenceException(String message) {
        super(message);
    }
}
