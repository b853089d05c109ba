package ai.docsite.autodoc.source;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shape checks for commit identifiers supplied by callers or by the reasoning engine.
 */
public final class CommitReferences {

    private static final Pattern REVISION_PATTERN = Pattern.compile("^[0-9a-f]{5,40}$");
    private static final Set<String> PLACEHOLDERS = Set.of(
            "[commit_id]",
            "test_commit_id",
            "actual-commit_id",
            "[example_commit_id]");

    private CommitReferences() {
    }

    public static boolean isValid(String commitId) {
        if (commitId == null || commitId.isBlank()) {
            return false;
        }
        if (PLACEHOLDERS.contains(commitId)) {
            return false;
        }
        return REVISION_PATTERN.matcher(commitId).matches();
    }

    public static String requireValid(String commitId) {
        if (commitId == null || commitId.isBlank()) {
            throw new InvalidReferenceException("A commit identifier is required");
        }
        if (PLACEHOLDERS.contains(commitId)) {
            throw new InvalidReferenceException("Placeholder commit identifier: " + commitId);
        }
        if (!REVISION_PATTERN.matcher(commitId).matches()) {
            throw new InvalidReferenceException("Invalid commit identifier format: \"" + commitId + "\"");
        }
        return commitId;
    }
}
