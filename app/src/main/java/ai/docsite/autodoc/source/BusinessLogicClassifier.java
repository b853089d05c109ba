package ai.docsite.autodoc.source;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Heuristically decides whether a file patch changes behaviour rather than formatting, comments or imports.
 */
public class BusinessLogicClassifier {

    static final String MINOR_CHANGE_DESCRIPTION = "Minor changes (documentation, formatting, or imports)";

    private static final List<Pattern> LOGIC_PATTERNS = List.of(
            Pattern.compile("\\+\\s*function\\s+\\w+\\s*\\([^)]*\\)\\s*\\{[^}]+}"),
            Pattern.compile("\\+\\s*\\w+\\s*\\([^)]*\\)\\s*\\{[^}]+}"),
            Pattern.compile("\\+\\s*(if|else|switch|case|while|for)"),
            Pattern.compile("\\+\\s*\\w+\\s*=\\s*([^;]+[+\\-*/&|!?:]|function|\\([^)]*\\)\\s*=>)"),
            Pattern.compile("\\+\\s*export\\s+const\\s+\\w+\\s*="),
            Pattern.compile("\\+\\s*/[^/]+/[gimsuy]*"),
            Pattern.compile("\\+\\s*(query|select|insert|update|delete|findOne|findById|save|create)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\+\\s*(setState|dispatch|useReducer|useState)"));

    private static final List<Description> DESCRIPTIONS = List.of(
            new Description(Pattern.compile("\\+\\s*if\\s*\\([^)]+\\)"), "Added conditional logic"),
            new Description(Pattern.compile("\\+\\s*for\\s*\\([^)]+\\)"), "Added loop or iteration"),
            new Description(Pattern.compile("\\+\\s*function\\s+\\w+\\s*\\([^)]*\\)"),
                    "Added or modified function implementation"),
            new Description(Pattern.compile("\\+\\s*export\\s+const\\s+\\w+\\s*="),
                    "Modified business constants or configuration"),
            new Description(Pattern.compile("\\+\\s*switch\\s*\\([^)]+\\)"),
                    "Changed switch statement or case handling"),
            new Description(Pattern.compile("\\+\\s*try\\s*\\{"), "Added error handling logic"),
            new Description(Pattern.compile("\\+\\s*\\w+\\s*=\\s*\\([^)]*\\)\\s*=>"),
                    "Modified function implementation or callback"));

    public Classification classify(String patchText) {
        String added = addedLines(patchText);
        boolean logicChange = !added.isEmpty() && LOGIC_PATTERNS.stream().anyMatch(p -> p.matcher(added).find());
        if (!logicChange) {
            return new Classification(false, MINOR_CHANGE_DESCRIPTION);
        }
        String description = DESCRIPTIONS.stream()
                .filter(d -> d.pattern().matcher(added).find())
                .map(Description::text)
                .findFirst()
                .orElse("Modified business logic implementation");
        return new Classification(true, description);
    }

    // file headers ("+++ b/path") are not content
    private static String addedLines(String patchText) {
        if (patchText == null || patchText.isEmpty()) {
            return "";
        }
        return patchText.lines()
                .filter(line -> line.startsWith("+") && !line.startsWith("+++"))
                .collect(Collectors.joining("\n"));
    }

    public record Classification(boolean logicChange, String description) {
    }

    private record Description(Pattern pattern, String text) {
    }
}
