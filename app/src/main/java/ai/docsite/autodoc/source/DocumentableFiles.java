package ai.docsite.autodoc.source;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which repository paths are source files worth documenting.
 */
public class DocumentableFiles {

    private static final Set<String> DEFAULT_EXTENSIONS = Set.of("ts", "tsx", "js", "jsx", "py", "go", "java", "rb");
    private static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES =
            Set.of("node_modules", ".git", "dist", "build", ".next", "__pycache__");

    private final Set<String> extensions;
    private final Set<String> excludedDirectories;

    public DocumentableFiles() {
        this(DEFAULT_EXTENSIONS, DEFAULT_EXCLUDED_DIRECTORIES);
    }

    public DocumentableFiles(Set<String> extensions, Set<String> excludedDirectories) {
        this.extensions = Set.copyOf(Objects.requireNonNull(extensions, "extensions"));
        this.excludedDirectories = Set.copyOf(Objects.requireNonNull(excludedDirectories, "excludedDirectories"));
    }

    public boolean isDocumentable(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String normalized = path.replace('\\', '/');
        if (!extensions.contains(extensionOf(normalized))) {
            return false;
        }
        for (String directory : excludedDirectories) {
            if (normalized.startsWith(directory + "/") || normalized.contains("/" + directory + "/")) {
                return false;
            }
        }
        return true;
    }

    public List<String> filter(List<String> paths) {
        return paths.stream().filter(this::isDocumentable).toList();
    }

    private static String extensionOf(String path) {
        int slash = path.lastIndexOf('/');
        int idx = path.lastIndexOf('.') + 1;
        if (idx <= slash + 1 || idx == path.length()) {
            return "";
        }
        return path.substring(idx).toLowerCase(Locale.ROOT);
    }
}
