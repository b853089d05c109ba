package ai.docsite.autodoc.source;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Follows relative and project-aliased imports of a source file to collect its internal dependencies.
 */
public class DependencyScanner {

    private static final Pattern ES_IMPORT = Pattern.compile("import\\s+(?:[\\w*\\s{},]*)\\s+from\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern REQUIRE = Pattern.compile("require\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");
    private static final List<String> RESOLVABLE_EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx");
    private static final List<String> ALIAS_ROOTS = List.of("", "src/", "app/", "components/");
    private static final List<String> PROJECT_SEGMENTS = List.of(
            "/components/", "/lib/", "/app/", "/pages/", "/utils/", "/hooks/", "/services/", "/api/",
            "/config/", "/constants/", "/contexts/", "/data/", "/interfaces/", "/layouts/", "/models/",
            "/redux/", "/store/", "/styles/", "/types/", "/views/");

    /**
     * Scans {@code rootPath} and every internal file it reaches. The loader returns file content for a
     * repository-relative path, or empty when the path does not exist.
     *
     * @return dependencies in discovery order, excluding the root itself
     */
    public List<String> scan(String rootPath, Function<String, Optional<String>> loader) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        String root = normalize(rootPath);
        visited.add(root);
        pending.add(root);
        List<String> dependencies = new ArrayList<>();
        while (!pending.isEmpty()) {
            String current = pending.poll();
            Optional<String> content = loader.apply(current);
            if (content.isEmpty()) {
                continue;
            }
            for (String specifier : internalImports(content.get())) {
                Optional<String> resolved = resolve(current, specifier, loader);
                if (resolved.isPresent() && visited.add(resolved.get())) {
                    dependencies.add(resolved.get());
                    pending.add(resolved.get());
                }
            }
        }
        return List.copyOf(dependencies);
    }

    static boolean isInternal(String specifier) {
        if (specifier.startsWith("./") || specifier.startsWith("../")
                || specifier.startsWith("/") || specifier.startsWith("@/")) {
            return true;
        }
        if (specifier.startsWith("@")) {
            return false;
        }
        return PROJECT_SEGMENTS.stream().anyMatch(specifier::contains);
    }

    static Set<String> internalImports(String content) {
        Set<String> imports = new LinkedHashSet<>();
        collect(ES_IMPORT.matcher(content), imports);
        collect(REQUIRE.matcher(content), imports);
        return imports;
    }

    private static void collect(Matcher matcher, Set<String> imports) {
        while (matcher.find()) {
            String specifier = matcher.group(1);
            if (isInternal(specifier)) {
                imports.add(specifier);
            }
        }
    }

    private Optional<String> resolve(String importer, String specifier,
                                     Function<String, Optional<String>> loader) {
        List<String> bases = new ArrayList<>();
        if (specifier.startsWith("@/")) {
            String withoutAlias = specifier.substring(2);
            for (String aliasRoot : ALIAS_ROOTS) {
                bases.add(normalize(aliasRoot + withoutAlias));
            }
        } else if (specifier.startsWith("/")) {
            bases.add(normalize(specifier.substring(1)));
        } else {
            int slash = importer.lastIndexOf('/');
            String directory = slash < 0 ? "" : importer.substring(0, slash + 1);
            bases.add(normalize(directory + specifier));
        }
        for (String base : bases) {
            if (base.isEmpty()) {
                continue;
            }
            for (String candidate : candidates(base)) {
                if (loader.apply(candidate).isPresent()) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> candidates(String base) {
        List<String> candidates = new ArrayList<>();
        if (hasExtension(base)) {
            candidates.add(base);
        }
        for (String extension : RESOLVABLE_EXTENSIONS) {
            candidates.add(base + extension);
        }
        for (String extension : RESOLVABLE_EXTENSIONS) {
            candidates.add(base + "/index" + extension);
        }
        return candidates;
    }

    private static boolean hasExtension(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot > slash + 1 && dot < path.length() - 1;
    }

    // collapses "." and ".." segments; paths escaping the repository root resolve to ""
    static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return "";
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        return String.join("/", segments);
    }
}
