package ai.docsite.autodoc.page;

import java.util.Locale;

/**
 * Derives page titles from source file paths.
 */
public final class PageTitles {

    static final String SUFFIX = " Documentation";

    private PageTitles() {
    }

    /**
     * {@code src/lib/date-utils.ts} becomes {@code Date Utils Documentation}.
     */
    public static String forFile(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return "Documentation";
        }
        String normalized = filePath.trim().replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        StringBuilder title = new StringBuilder();
        for (String word : base.split("[-_.\\s]+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        if (title.length() == 0) {
            return "Documentation";
        }
        return title + SUFFIX;
    }
}
