package ai.docsite.autodoc.source;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.RawTextComparator;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.PathFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SourceReader} over a local Git clone. The repository is opened per call so instances can be shared
 * between concurrently running tasks.
 */
public class GitSourceReader implements SourceReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(GitSourceReader.class);

    private final Path repositoryRoot;
    private final String mainBranch;
    private final DocumentableFiles documentableFiles;
    private final DependencyScanner dependencyScanner;
    private final BusinessLogicClassifier classifier;

    public GitSourceReader(Path repositoryRoot, String mainBranch) {
        this(repositoryRoot, mainBranch, new DocumentableFiles(), new DependencyScanner(), new BusinessLogicClassifier());
    }

    public GitSourceReader(Path repositoryRoot,
                           String mainBranch,
                           DocumentableFiles documentableFiles,
                           DependencyScanner dependencyScanner,
                           BusinessLogicClassifier classifier) {
        this.repositoryRoot = Objects.requireNonNull(repositoryRoot, "repositoryRoot");
        this.mainBranch = Objects.requireNonNull(mainBranch, "mainBranch");
        this.documentableFiles = Objects.requireNonNull(documentableFiles, "documentableFiles");
        this.dependencyScanner = Objects.requireNonNull(dependencyScanner, "dependencyScanner");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public String readFile(String path, Optional<String> revision) {
        String normalized = requirePath(path);
        String label = revision.orElse(mainBranch);
        return withRepository("read " + normalized, git -> {
            Repository repository = git.getRepository();
            ObjectId commitId = revision.isPresent() ? resolveCommit(repository, revision.get()) : resolveMain(repository);
            return readBlob(repository, commitId, normalized)
                    .orElseThrow(() -> new SourceFileNotFoundException(normalized, label));
        });
    }

    @Override
    public DiffInfo diff(String commitId) {
        CommitReferences.requireValid(commitId);
        return withRepository("diff " + commitId, git -> {
            Repository repository = git.getRepository();
            ObjectId id = resolveCommit(repository, commitId);
            try (RevWalk walk = new RevWalk(repository)) {
                RevCommit commit = walk.parseCommit(id);
                List<String> changedFiles = new ArrayList<>();
                String patch = formatPatch(repository, commit, Optional.empty(), changedFiles);
                LOGGER.debug("Commit {} touches {} files", commit.abbreviate(7).name(), changedFiles.size());
                return new DiffInfo(commit.getName(), patch, changedFiles);
            }
        });
    }

    @Override
    public List<String> listChangedFiles(String commitId) {
        return documentableFiles.filter(diff(commitId).changedFiles());
    }

    @Override
    public List<String> listInternalDependencies(String path) {
        String normalized = requirePath(path);
        return withRepository("scan dependencies of " + normalized, git -> {
            Repository repository = git.getRepository();
            ObjectId head = resolveMain(repository);
            if (readBlob(repository, head, normalized).isEmpty()) {
                throw new SourceFileNotFoundException(normalized, mainBranch);
            }
            return dependencyScanner.scan(normalized, candidate -> {
                try {
                    return readBlob(repository, head, candidate);
                } catch (IOException ex) {
                    throw new SourceControlException("Failed to read " + candidate, ex);
                }
            });
        });
    }

    @Override
    public List<HistoryEntry> getHistory(String path, int limit) {
        String normalized = requirePath(path);
        if (limit <= 0) {
            return List.of();
        }
        return withRepository("read history of " + normalized, git -> {
            Repository repository = git.getRepository();
            Iterable<RevCommit> commits = git.log()
                    .add(resolveMain(repository))
                    .addPath(normalized)
                    .setMaxCount(limit)
                    .call();
            List<HistoryEntry> entries = new ArrayList<>();
            for (RevCommit commit : commits) {
                String patch = formatPatch(repository, commit, Optional.of(normalized), new ArrayList<>());
                BusinessLogicClassifier.Classification classification = classifier.classify(patch);
                PersonIdent author = commit.getAuthorIdent();
                entries.add(new HistoryEntry(commit.getName(),
                        commit.getFullMessage().trim(),
                        author.getName(),
                        Instant.ofEpochSecond(commit.getCommitTime()).toString(),
                        classification.logicChange(),
                        classification.description()));
            }
            return entries;
        });
    }

    @Override
    public CommitInfo commitInfo(String commitId) {
        CommitReferences.requireValid(commitId);
        return withRepository("inspect " + commitId, git -> {
            Repository repository = git.getRepository();
            ObjectId id = resolveCommit(repository, commitId);
            try (RevWalk walk = new RevWalk(repository)) {
                RevCommit commit = walk.parseCommit(id);
                List<String> files = new ArrayList<>();
                formatPatch(repository, commit, Optional.empty(), files);
                PersonIdent author = commit.getAuthorIdent();
                return new CommitInfo(commit.getName(),
                        commit.getFullMessage().trim(),
                        author.getName(),
                        author.getEmailAddress(),
                        Instant.ofEpochSecond(commit.getCommitTime()),
                        files);
            }
        });
    }

    private String formatPatch(Repository repository,
                               RevCommit commit,
                               Optional<String> pathFilter,
                               List<String> changedFiles) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.setRepository(repository);
            formatter.setDiffComparator(RawTextComparator.DEFAULT);
            formatter.setDetectRenames(true);
            pathFilter.ifPresent(path -> formatter.setPathFilter(PathFilter.create(path)));
            List<DiffEntry> entries = formatter.scan(parentTree(repository, commit), treeOf(repository, commit));
            for (DiffEntry entry : entries) {
                changedFiles.add(resolvePath(entry));
            }
            formatter.format(entries);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private AbstractTreeIterator parentTree(Repository repository, RevCommit commit) throws IOException {
        if (commit.getParentCount() == 0) {
            return new EmptyTreeIterator();
        }
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit parent = walk.parseCommit(commit.getParent(0).getId());
            return treeOf(repository, parent);
        }
    }

    private CanonicalTreeParser treeOf(Repository repository, RevCommit commit) throws IOException {
        try (ObjectReader reader = repository.newObjectReader()) {
            CanonicalTreeParser parser = new CanonicalTreeParser();
            parser.reset(reader, commit.getTree().getId());
            return parser;
        }
    }

    private Optional<String> readBlob(Repository repository, ObjectId commitId, String path) throws IOException {
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(commitId);
            try (TreeWalk treeWalk = TreeWalk.forPath(repository, path, commit.getTree())) {
                if (treeWalk == null || treeWalk.isSubtree()) {
                    return Optional.empty();
                }
                byte[] bytes = repository.open(treeWalk.getObjectId(0)).getBytes();
                return Optional.of(new String(bytes, StandardCharsets.UTF_8));
            }
        }
    }

    private ObjectId resolveMain(Repository repository) throws IOException {
        ObjectId id = repository.resolve(mainBranch + "^{commit}");
        if (id == null) {
            id = repository.resolve(Constants.HEAD + "^{commit}");
        }
        if (id == null) {
            throw new SourceControlException("Repository at " + repositoryRoot + " has no commits on " + mainBranch);
        }
        return id;
    }

    private ObjectId resolveCommit(Repository repository, String revision) throws IOException {
        try {
            ObjectId id = repository.resolve(revision + "^{commit}");
            if (id == null) {
                throw new CommitNotFoundException(revision);
            }
            return id;
        } catch (RevisionSyntaxException | MissingObjectException ex) {
            throw new CommitNotFoundException(revision, ex);
        }
    }

    private static String resolvePath(DiffEntry entry) {
        return switch (entry.getChangeType()) {
            case DELETE -> entry.getOldPath();
            default -> entry.getNewPath();
        };
    }

    private static String requirePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        String normalized = path.trim().replace('\\', '/');
        return normalized.startsWith("/") ? normalized.substring(1) : normalized;
    }

    private <T> T withRepository(String operation, RepositoryCallback<T> callback) {
        try (Git git = Git.open(repositoryRoot.toFile())) {
            return callback.apply(git);
        } catch (GitAPIException | IOException ex) {
            throw new SourceControlException("Failed to " + operation, ex);
        }
    }

    @FunctionalInterface
    private interface RepositoryCallback<T> {
        T apply(Git git) throws IOException, GitAPIException;
    }
}
