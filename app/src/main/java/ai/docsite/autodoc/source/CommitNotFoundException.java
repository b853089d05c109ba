package ai.docsite.autodoc.source;

public class CommitNotFoundException extends SourceControlException {

    public CommitNotFoundException(String commitId) {
        super("Commit not found: " + commitId);
    }

    public CommitNotFoundException(String commitId, Throwable cause) {
        super("Commit not found: " + commitId, cause);
    }
}
