package ai.docsite.autodoc.source;

public class SourceFileNotFoundException extends SourceControlException {

    public SourceFileNotFoundException(String path, String revision) {
        super("File not found: " + path + " at " + revision);
    }
}
