package ai.docsite.autodoc.agent;

/**
 * The reasoning engine could not be reached or answered with something unusable.
 */
public class EngineUnavailableException extends RuntimeException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
