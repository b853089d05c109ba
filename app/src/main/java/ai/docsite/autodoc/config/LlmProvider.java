package ai.docsite.autodoc.config;

import java.util.Locale;

/**
 * Supported reasoning engine providers.
 */
public enum LlmProvider {
    OPENAI,
    GEMINI,
    OLLAMA;

    public static LlmProvider from(String value) {
        if (value == null) {
            return OPENAI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "openai", "" -> OPENAI;
            case "gemini" -> GEMINI;
            case "ollama" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }

    public String defaultModel() {
        return switch (this) {
            case OPENAI -> "gpt-4o-mini";
            case GEMINI -> "gemini-1.5-pro";
            case OLLAMA -> "llama3.1";
        };
    }

    /**
     * Whether the provider accepts a request that forces a tool call.
     */
    public boolean supportsRequiredToolChoice() {
        return this != OLLAMA;
    }
}
