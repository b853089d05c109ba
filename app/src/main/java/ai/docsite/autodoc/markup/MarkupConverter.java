package ai.docsite.autodoc.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts markdown documentation into Confluence storage format (XHTML plus the {@code code} macro).
 */
public class MarkupConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkupConverter.class);

    private static final Pattern FENCE = Pattern.compile("^\\s*```\\s*([\\w+#.-]*)\\s*$");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*?)(?:\\s+#+)?\\s*$");
    private static final Pattern BULLET = Pattern.compile("^\\s*[-*+]\\s+(.*)$");
    private static final Pattern ORDERED = Pattern.compile("^\\s*\\d+[.)]\\s+(.*)$");
    private static final Pattern TABLE_ROW = Pattern.compile("^\\s*\\|.*\\|\\s*$");
    private static final Pattern TABLE_SEPARATOR = Pattern.compile("^\\s*\\|?\\s*:?-{3,}:?\\s*(\\|\\s*:?-{3,}:?\\s*)*\\|?\\s*$");
    private static final Pattern HORIZONTAL_RULE = Pattern.compile("^\\s*([-*_])(\\s*\\1){2,}\\s*$");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)]\\(([^)\\s]+)\\)");
    private static final Pattern STRONG = Pattern.compile("\\*\\*(.+?)\\*\\*|__(.+?)__");
    private static final Pattern EMPHASIS = Pattern.compile("\\*(?!\\s)(.+?)\\*|(?<![\\w/])_(?!\\s)(.+?)_(?!\\w)");

    public String toMarkup(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            throw new IllegalArgumentException("Cannot convert empty markdown");
        }
        List<String> lines = markdown.replace("\r\n", "\n").lines().toList();
        StringBuilder out = new StringBuilder(markdown.length() + 64);
        List<String> paragraph = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            String line = lines.get(index);
            Matcher fence = FENCE.matcher(line);
            if (fence.matches()) {
                flushParagraph(paragraph, out);
                index = appendCodeBlock(lines, index, fence.group(1), out);
                continue;
            }
            if (line.isBlank()) {
                flushParagraph(paragraph, out);
                index++;
                continue;
            }
            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                flushParagraph(paragraph, out);
                int level = heading.group(1).length();
                out.append("<h").append(level).append('>')
                        .append(inline(heading.group(2)))
                        .append("</h").append(level).append('>');
                index++;
                continue;
            }
            if (HORIZONTAL_RULE.matcher(line).matches()) {
                flushParagraph(paragraph, out);
                out.append("<hr />");
                index++;
                continue;
            }
            if (TABLE_ROW.matcher(line).matches()) {
                flushParagraph(paragraph, out);
                index = appendTable(lines, index, out);
                continue;
            }
            if (BULLET.matcher(line).matches()) {
                flushParagraph(paragraph, out);
                index = appendList(lines, index, BULLET, "ul", out);
                continue;
            }
            if (ORDERED.matcher(line).matches()) {
                flushParagraph(paragraph, out);
                index = appendList(lines, index, ORDERED, "ol", out);
                continue;
            }
            paragraph.add(line.trim());
            index++;
        }
        flushParagraph(paragraph, out);
        LOGGER.debug("Converted {} markdown chars into {} markup chars", markdown.length(), out.length());
        return out.toString();
    }

    private int appendCodeBlock(List<String> lines, int start, String language, StringBuilder out) {
        List<String> body = new ArrayList<>();
        int index = start + 1;
        while (index < lines.size() && !FENCE.matcher(lines.get(index)).matches()) {
            body.add(lines.get(index));
            index++;
        }
        out.append("<ac:structured-macro ac:name=\"code\">");
        if (!language.isEmpty()) {
            out.append("<ac:parameter ac:name=\"language\">").append(escape(language)).append("</ac:parameter>");
        }
        out.append("<ac:plain-text-body><![CDATA[")
                .append(String.join("\n", body).replace("]]>", "]]]]><![CDATA[>"))
                .append("]]></ac:plain-text-body></ac:structured-macro>");
        // skip the closing fence; an unterminated block runs to the end of the document
        return Math.min(index + 1, lines.size());
    }

    private int appendList(List<String> lines, int start, Pattern item, String tag, StringBuilder out) {
        out.append('<').append(tag).append('>');
        int index = start;
        while (index < lines.size()) {
            Matcher matcher = item.matcher(lines.get(index));
            if (!matcher.matches()) {
                break;
            }
            out.append("<li>").append(inline(matcher.group(1).trim())).append("</li>");
            index++;
        }
        out.append("</").append(tag).append('>');
        return index;
    }

    private int appendTable(List<String> lines, int start, StringBuilder out) {
        List<String> rows = new ArrayList<>();
        int index = start;
        while (index < lines.size() && TABLE_ROW.matcher(lines.get(index)).matches()) {
            rows.add(lines.get(index));
            index++;
        }
        boolean hasHeader = rows.size() > 1 && TABLE_SEPARATOR.matcher(rows.get(1)).matches();
        out.append("<table><tbody>");
        for (int i = 0; i < rows.size(); i++) {
            if (hasHeader && i == 1) {
                continue;
            }
            String cellTag = hasHeader && i == 0 ? "th" : "td";
            out.append("<tr>");
            for (String cell : cells(rows.get(i))) {
                out.append('<').append(cellTag).append('>').append(inline(cell)).append("</").append(cellTag).append('>');
            }
            out.append("</tr>");
        }
        out.append("</tbody></table>");
        return index;
    }

    private static List<String> cells(String row) {
        String trimmed = row.trim();
        String inner = trimmed.substring(1, trimmed.length() - 1);
        List<String> cells = new ArrayList<>();
        for (String cell : inner.split("\\|", -1)) {
            cells.add(cell.trim());
        }
        return cells;
    }

    private void flushParagraph(List<String> paragraph, StringBuilder out) {
        if (paragraph.isEmpty()) {
            return;
        }
        out.append("<p>").append(inline(String.join(" ", paragraph))).append("</p>");
        paragraph.clear();
    }

    String inline(String text) {
        StringBuilder result = new StringBuilder();
        Matcher code = INLINE_CODE.matcher(text);
        int last = 0;
        while (code.find()) {
            result.append(formatText(text.substring(last, code.start())));
            result.append("<code>").append(escape(code.group(1))).append("</code>");
            last = code.end();
        }
        result.append(formatText(text.substring(last)));
        return result.toString();
    }

    private static String formatText(String text) {
        if (text.isEmpty()) {
            return text;
        }
        String escaped = escape(text);
        escaped = LINK.matcher(escaped).replaceAll("<a href=\"$2\">$1</a>");
        escaped = replaceAlternatives(STRONG, escaped, "strong");
        return replaceAlternatives(EMPHASIS, escaped, "em");
    }

    private static String replaceAlternatives(Pattern pattern, String text, String tag) {
        return pattern.matcher(text).replaceAll(match -> {
            String content = match.group(1) != null ? match.group(1) : match.group(2);
            return Matcher.quoteReplacement("<" + tag + ">" + content + "</" + tag + ">");
        });
    }

    static String escape(String text) {
        StringBuilder builder = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '&' -> builder.append("&amp;");
                case '<' -> builder.append("&lt;");
                case '>' -> builder.append("&gt;");
                case '"' -> builder.append("&quot;");
                default -> builder.append(ch);
            }
        }
        return builder.toString();
    }
}
