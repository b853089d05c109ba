package ai.docsite.autodoc.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Subset of a repository push event payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PushEvent(String ref, List<Commit> commits) {

    private static final String BRANCH_PREFIX = "refs/heads/";

    public PushEvent {
        ref = ref == null ? "" : ref;
        commits = commits == null ? List.of() : List.copyOf(commits);
    }

    public String branch() {
        return ref.startsWith(BRANCH_PREFIX) ? ref.substring(BRANCH_PREFIX.length()) : ref;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Commit(String id, String message) {
    }
}
