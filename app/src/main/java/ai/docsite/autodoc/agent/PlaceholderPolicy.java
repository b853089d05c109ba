package ai.docsite.autodoc.agent;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Sentinel values an engine writes when it never looked up the real page.
 *
 * @param matchRetrievedTokens whether any bracketed {@code [retrieved ...]} token also counts as a placeholder
 */
public record PlaceholderPolicy(Set<String> pageIds,
                                Set<String> titles,
                                Set<String> versions,
                                boolean matchRetrievedTokens) {

    public static final Set<String> DEFAULT_PAGE_IDS = Set.of("123", "[Retrieved pageId]", "retrieved-page-id");
    public static final Set<String> DEFAULT_TITLES = Set.of("[Retrieved title]");
    public static final Set<String> DEFAULT_VERSIONS = Set.of("0", "1", "[Retrieved version]");

    private static final Pattern RETRIEVED_TOKEN = Pattern.compile("^\\[\\s*retrieved\\b[^\\]]*]$", Pattern.CASE_INSENSITIVE);

    public PlaceholderPolicy {
        pageIds = normalized(Objects.requireNonNull(pageIds, "pageIds"));
        titles = normalized(Objects.requireNonNull(titles, "titles"));
        versions = normalized(Objects.requireNonNull(versions, "versions"));
    }

    public PlaceholderPolicy(Set<String> pageIds, Set<String> titles, Set<String> versions) {
        this(pageIds, titles, versions, true);
    }

    public static PlaceholderPolicy defaults() {
        return new PlaceholderPolicy(DEFAULT_PAGE_IDS, DEFAULT_TITLES, DEFAULT_VERSIONS, true);
    }

    public boolean isPageIdPlaceholder(Object value) {
        return matches(value, pageIds);
    }

    public boolean isTitlePlaceholder(Object value) {
        return matches(value, titles);
    }

    public boolean isVersionPlaceholder(Object value) {
        return matches(value, versions);
    }

    private boolean matches(Object value, Set<String> sentinels) {
        if (value == null) {
            return false;
        }
        String text = String.valueOf(value).trim();
        if (sentinels.contains(text.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return matchRetrievedTokens && RETRIEVED_TOKEN.matcher(text).matches();
    }

    private static Set<String> normalized(Set<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
