package ai.docsite.autodoc.agent;

import java.util.Locale;

public enum PhaseName {
    RETRIEVAL,
    ANALYSIS,
    PUBLISH;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
