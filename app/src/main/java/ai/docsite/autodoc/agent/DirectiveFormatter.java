package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionName;
import ai.docsite.autodoc.page.PageTitles;
import ai.docsite.autodoc.task.DocumentationTask;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the system and per-phase user directives sent to the engine.
 */
final class DirectiveFormatter {

    static final int DEFAULT_HISTORY_LIMIT = 15;
    static final int DEFAULT_DIGEST_CHARS = 4000;

    private static final String ROLE = """
            You are a technical writer with expertise in software documentation. You write documentation that \
            explains the business logic, module dependencies and version history of source files, readable by \
            product owners and developers of every level. You work only through the actions you are given and \
            you use their exact names.""";

    private final int historyLimit;
    private final int digestChars;

    DirectiveFormatter() {
        this(DEFAULT_HISTORY_LIMIT, DEFAULT_DIGEST_CHARS);
    }

    DirectiveFormatter(int historyLimit, int digestChars) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive");
        }
        if (digestChars < 1) {
            throw new IllegalArgumentException("digestChars must be positive");
        }
        this.historyLimit = historyLimit;
        this.digestChars = digestChars;
    }

    String system(DocumentationTask task) {
        if (task.isGenerate()) {
            return ROLE + "\n\n" + """
                    Task: create new documentation for one source file and publish it as a page.
                    Always structure the markdown with the sections "Module Dependencies", "Business Logic" \
                    and "Version History". Write markdown first, convert it with convert-to-markup, then \
                    publish the converted markup with create-page.""";
        }
        return ROLE + "\n\n" + """
                Task: update existing documentation after a code change and publish the new revision.
                Base the update on the actual diff content, not only on the list of changed files. Keep the \
                sections "Module Dependencies", "Business Logic" and "Version History" and add the new commit \
                to the version history. Every update MUST call convert-to-markup and update-page; they are not \
                optional. When a page id is given, use it directly rather than searching.""";
    }

    String retrieval(DocumentationTask task, PlanVariant variant) {
        StringBuilder builder = new StringBuilder();
        switch (variant) {
            case GENERATE -> {
                String path = task.filePath().orElseThrow();
                builder.append("Gather everything needed to document the file ").append(path).append(".\n")
                        .append("1. Call read-file with path=\"").append(path).append("\".\n")
                        .append("2. Call list-internal-dependencies with path=\"").append(path).append("\".\n")
                        .append("   Read the most important dependencies with read-file.\n")
                        .append("3. Call get-history with path=\"").append(path).append("\" and limit=")
                        .append(historyLimit).append(".\n");
            }
            case UPDATE_BY_PAGE_ID -> {
                String pageId = task.pageId().orElseThrow();
                builder.append("Gather everything needed to update documentation page ").append(pageId).append(".\n")
                        .append("1. Call get-page with pageId=\"").append(pageId).append("\".\n");
                if (task.commitId().isPresent()) {
                    builder.append("2. Call diff-commit with commitId=\"").append(task.commitId().get()).append("\".\n");
                } else {
                    builder.append("2. No commit id was given. Find the latest commit of the documented file with ")
                            .append("get-history and call diff-commit with its id.\n");
                }
            }
            case UPDATE_BY_COMMIT -> {
                String commitId = task.commitId().orElseThrow();
                builder.append("Gather everything needed to update the documentation affected by commit ")
                        .append(commitId).append(".\n")
                        .append("1. Call diff-commit with commitId=\"").append(commitId).append("\".\n")
                        .append("2. For the most relevant changed source file, call find-page-by-title with spaceId=\"")
                        .append(task.spaceId()).append("\" and the title derived from its file name, for example ")
                        .append("\"src/lib/date-utils.ts\" is titled \"").append(PageTitles.forFile("src/lib/date-utils.ts"))
                        .append("\".\n");
            }
        }
        builder.append("Summarize what you found when you are done. Do not write the final documentation yet.");
        return builder.toString();
    }

    String analysis(String priorText, boolean recoveryRan, List<ActionInvocationRecord> gathered) {
        StringBuilder builder = new StringBuilder();
        if (!priorText.isBlank()) {
            builder.append("Findings so far:\n").append(priorText).append("\n\n");
        }
        if (recoveryRan) {
            builder.append("Some data was gathered in a second attempt; it is included below.\n\n");
        }
        builder.append("Gathered action results:\n").append(digest(gathered)).append("\n\n")
                .append("Now write the complete documentation in markdown with the sections ")
                .append("\"Module Dependencies\", \"Business Logic\" and \"Version History\". ")
                .append("Reply with the markdown only.");
        return builder.toString();
    }

    String publish(DocumentationTask task, String analysisText, List<ActionName> required,
                   DiscoveredEntities discovered) {
        StringBuilder builder = new StringBuilder();
        builder.append("Documentation to publish:\n").append(analysisText.isBlank() ? "(none yet, write it now)" : analysisText)
                .append("\n\n");
        builder.append("1. Call convert-to-markup with the markdown documentation.\n");
        if (task.isGenerate()) {
            String title = PageTitles.forFile(task.filePath().orElse(""));
            builder.append("2. Call create-page with spaceId=\"").append(task.spaceId())
                    .append("\", title=\"").append(title).append("\"");
            task.parentPageId().ifPresent(parent -> builder.append(", parentId=\"").append(parent).append("\""));
            builder.append(" and content set to the converted markup.\n");
        } else {
            builder.append("2. Call update-page with the page id, title and version of the page being updated and ")
                    .append("content set to the converted markup.\n");
        }
        if (discovered.hasPage()) {
            builder.append("Use these EXACT values: pageId=\"").append(discovered.pageId().get()).append("\"");
            discovered.pageTitle().ifPresent(title -> builder.append(", title=\"").append(title).append("\""));
            discovered.pageVersion().ifPresent(version -> builder.append(", version=").append(version));
            builder.append(".\n");
        }
        builder.append("Required actions: ").append(names(required)).append(".");
        return builder.toString();
    }

    String recovery(String priorText, String phaseDirective, Collection<ActionName> missing) {
        StringBuilder builder = new StringBuilder();
        if (!priorText.isBlank()) {
            builder.append("Your previous answer:\n").append(priorText).append("\n\n");
        }
        builder.append("The following required actions were NOT executed: ").append(names(missing)).append(".\n")
                .append("Call every one of them now before answering.\n\n")
                .append("Original instructions:\n").append(phaseDirective);
        return builder.toString();
    }

    String digest(List<ActionInvocationRecord> records) {
        if (records.isEmpty()) {
            return "(no action results)";
        }
        return records.stream()
                .map(record -> "- " + record.actionName() + " " + arguments(record.arguments())
                        + (record.error() ? " [error]" : "") + ": " + truncate(record.result()))
                .collect(Collectors.joining("\n"));
    }

    private static String arguments(Map<String, Object> arguments) {
        return arguments.entrySet().stream()
                .filter(entry -> !"content".equals(entry.getKey()) && !"markdown".equals(entry.getKey()))
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", "(", ")"));
    }

    private String truncate(String text) {
        if (text.length() <= digestChars) {
            return text;
        }
        return text.substring(0, digestChars) + "... [truncated]";
    }

    private static String names(Collection<ActionName> names) {
        return names.stream().map(ActionName::wireName).collect(Collectors.joining(", "));
    }
}
