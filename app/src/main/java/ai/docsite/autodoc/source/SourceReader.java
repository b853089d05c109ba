package ai.docsite.autodoc.source;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the documented source repository.
 */
public interface SourceReader {

    /**
     * Reads a file at the given revision, or at the head of the main branch when no revision is given.
     *
     * @throws SourceFileNotFoundException when the path does not exist at that revision
     */
    String readFile(String path, Optional<String> revision);

    /**
     * Returns the patch of a commit against its first parent.
     *
     * @throws InvalidReferenceException when the identifier is not a well-formed revision
     * @throws CommitNotFoundException when the identifier does not resolve
     */
    DiffInfo diff(String commitId);

    /**
     * Changed files of a commit that are worth documenting.
     */
    List<String> listChangedFiles(String commitId);

    /**
     * Internal (non third-party) dependencies of a file, followed recursively.
     */
    List<String> listInternalDependencies(String path);

    List<HistoryEntry> getHistory(String path, int limit);

    CommitInfo commitInfo(String commitId);
}
