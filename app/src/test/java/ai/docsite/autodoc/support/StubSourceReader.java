package ai.docsite.autodoc.support;

import ai.docsite.autodoc.source.CommitInfo;
import ai.docsite.autodoc.source.CommitNotFoundException;
import ai.docsite.autodoc.source.CommitReferences;
import ai.docsite.autodoc.source.DiffInfo;
import ai.docsite.autodoc.source.HistoryEntry;
import ai.docsite.autodoc.source.SourceFileNotFoundException;
import ai.docsite.autodoc.source.SourceReader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory source repository.
 */
public class StubSourceReader implements SourceReader {

    private final Map<String, String> files = new HashMap<>();
    private final Map<String, DiffInfo> diffs = new HashMap<>();
    private final Map<String, List<String>> dependencies = new HashMap<>();
    private final Map<String, List<HistoryEntry>> history = new HashMap<>();
    private final List<String> calls = new ArrayList<>();

    public StubSourceReader withFile(String path, String content) {
        files.put(path, content);
        return this;
    }

    public StubSourceReader withDiff(String commitId, String patch, String... changedFiles) {
        diffs.put(commitId, new DiffInfo(commitId, patch, List.of(changedFiles)));
        return this;
    }

    public StubSourceReader withDependencies(String path, String... dependencyPaths) {
        dependencies.put(path, List.of(dependencyPaths));
        return this;
    }

    public StubSourceReader withHistory(String path, HistoryEntry... entries) {
        history.put(path, List.of(entries));
        return this;
    }

    @Override
    public synchronized String readFile(String path, Optional<String> revision) {
        calls.add("readFile " + path);
        String content = files.get(path);
        if (content == null) {
            throw new SourceFileNotFoundException(path, revision.orElse("main"));
        }
        return content;
    }

    @Override
    public synchronized DiffInfo diff(String commitId) {
        calls.add("diff " + commitId);
        CommitReferences.requireValid(commitId);
        DiffInfo diff = diffs.get(commitId);
        if (diff == null) {
            throw new CommitNotFoundException(commitId);
        }
        return diff;
    }

    @Override
    public synchronized List<String> listChangedFiles(String commitId) {
        return diff(commitId).changedFiles();
    }

    @Override
    public synchronized List<String> listInternalDependencies(String path) {
        calls.add("dependencies " + path);
        return dependencies.getOrDefault(path, List.of());
    }

    @Override
    public synchronized List<HistoryEntry> getHistory(String path, int limit) {
        calls.add("history " + path);
        List<HistoryEntry> entries = history.getOrDefault(path, List.of());
        return entries.subList(0, Math.min(limit, entries.size()));
    }

    @Override
    public synchronized CommitInfo commitInfo(String commitId) {
        DiffInfo diff = diff(commitId);
        return new CommitInfo(commitId, "commit " + commitId, "Dev", "dev@example.com", Instant.EPOCH,
                diff.changedFiles());
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }
}
