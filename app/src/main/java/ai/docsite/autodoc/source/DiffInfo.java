package ai.docsite.autodoc.source;

import java.util.List;
import java.util.Objects;

/**
 * Unified patch of a commit together with the paths it touched.
 */
public record DiffInfo(String commitId, String patchText, List<String> changedFiles) {

    public DiffInfo {
        Objects.requireNonNull(commitId, "commitId");
        patchText = Objects.requireNonNullElse(patchText, "");
        changedFiles = List.copyOf(changedFiles == null ? List.of() : changedFiles);
    }
}
