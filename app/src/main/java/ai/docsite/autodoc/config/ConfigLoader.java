package ai.docsite.autodoc.config;

import ai.docsite.autodoc.agent.PlaceholderPolicy;
import ai.docsite.autodoc.cli.CliArguments;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_LLM_TEMPERATURE = "LLM_TEMPERATURE";
    static final String ENV_LLM_TIMEOUT_SECONDS = "LLM_TIMEOUT_SECONDS";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_CONFLUENCE_BASE_URL = "CONFLUENCE_BASE_URL";
    static final String ENV_CONFLUENCE_EMAIL = "CONFLUENCE_EMAIL";
    static final String ENV_CONFLUENCE_API_TOKEN = "CONFLUENCE_API_TOKEN";
    static final String ENV_SPACE_ID = "CONFLUENCE_DOCUMENTATION_SPACE_ID";
    static final String ENV_PARENT_PAGE_ID = "CONFLUENCE_DOCUMENTATION_PARENT_PAGE_ID";
    static final String ENV_GIT_REPO_PATH = "GIT_REPO_PATH";
    static final String ENV_GIT_MAIN_BRANCH = "GIT_MAIN_BRANCH";
    static final String ENV_WEBHOOK_SECRET = "WEBHOOK_SECRET";
    static final String ENV_WEBHOOK_PARALLELISM = "WEBHOOK_PARALLELISM";
    static final String ENV_AGENT_MAX_STEPS = "AGENT_MAX_STEPS";
    static final String ENV_AGENT_RESULT_DIGEST_CHARS = "AGENT_RESULT_DIGEST_CHARS";
    static final String ENV_DOC_HISTORY_LIMIT = "DOC_HISTORY_LIMIT";
    static final String ENV_PLACEHOLDER_PAGE_IDS = "PLACEHOLDER_PAGE_IDS";
    static final String ENV_PLACEHOLDER_TITLES = "PLACEHOLDER_TITLES";
    static final String ENV_PLACEHOLDER_VERSIONS = "PLACEHOLDER_VERSIONS";
    static final String ENV_PLACEHOLDER_RETRIEVED_TOKENS = "PLACEHOLDER_RETRIEVED_TOKENS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MAIN_BRANCH = "main";
    private static final double DEFAULT_TEMPERATURE = 0.1;
    private static final int DEFAULT_TIMEOUT_SECONDS = 120;
    private static final int DEFAULT_MAX_STEPS = 10;
    private static final int DEFAULT_RESULT_DIGEST_CHARS = 4000;
    private static final int DEFAULT_HISTORY_LIMIT = 15;
    private static final int DEFAULT_WEBHOOK_PARALLELISM = 2;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        LlmProvider provider = env(ENV_LLM_PROVIDER).map(LlmProvider::from).orElse(LlmProvider.OPENAI);
        String modelName = env(ENV_LLM_MODEL).orElse(provider.defaultModel());
        Optional<String> baseUrl = provider == LlmProvider.OLLAMA
                ? Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL))
                : Optional.empty();
        double temperature = env(ENV_LLM_TEMPERATURE)
                .map(raw -> parseDouble(raw, ENV_LLM_TEMPERATURE))
                .orElse(DEFAULT_TEMPERATURE);
        int timeoutSeconds = env(ENV_LLM_TIMEOUT_SECONDS)
                .map(raw -> parsePositiveInteger(raw, ENV_LLM_TIMEOUT_SECONDS))
                .orElse(DEFAULT_TIMEOUT_SECONDS);
        EngineConfig engineConfig = new EngineConfig(provider, modelName, baseUrl, temperature,
                Duration.ofSeconds(timeoutSeconds));

        Optional<String> openAiApiKey = env(ENV_OPENAI_API_KEY);
        Optional<String> geminiApiKey = env(ENV_GEMINI_API_KEY);
        if (provider == LlmProvider.OPENAI && openAiApiKey.isEmpty()) {
            throw new IllegalStateException(ENV_OPENAI_API_KEY + " must be provided when LLM_PROVIDER=openai");
        }
        if (provider == LlmProvider.GEMINI && geminiApiKey.isEmpty()) {
            throw new IllegalStateException(ENV_GEMINI_API_KEY + " must be provided when LLM_PROVIDER=gemini");
        }

        URI confluenceUrl = env(ENV_CONFLUENCE_BASE_URL)
                .map(URI::create)
                .orElseThrow(() -> new IllegalStateException(ENV_CONFLUENCE_BASE_URL + " must be provided"));
        String email = env(ENV_CONFLUENCE_EMAIL)
                .orElseThrow(() -> new IllegalStateException(ENV_CONFLUENCE_EMAIL + " must be provided"));
        String apiToken = env(ENV_CONFLUENCE_API_TOKEN)
                .orElseThrow(() -> new IllegalStateException(ENV_CONFLUENCE_API_TOKEN + " must be provided"));
        ConfluenceSettings confluence = new ConfluenceSettings(confluenceUrl, email,
                firstNonBlank(arguments.spaceId(), ENV_SPACE_ID),
                firstNonBlank(arguments.parentPageId(), ENV_PARENT_PAGE_ID));

        Path repositoryPath = arguments.repositoryPath() != null
                ? arguments.repositoryPath()
                : Path.of(env(ENV_GIT_REPO_PATH).orElse("."));
        String mainBranch = env(ENV_GIT_MAIN_BRANCH).orElse(DEFAULT_MAIN_BRANCH);

        int maxSteps = resolveMaxSteps(arguments);
        int digestChars = env(ENV_AGENT_RESULT_DIGEST_CHARS)
                .map(raw -> parsePositiveInteger(raw, ENV_AGENT_RESULT_DIGEST_CHARS))
                .orElse(DEFAULT_RESULT_DIGEST_CHARS);
        int historyLimit = env(ENV_DOC_HISTORY_LIMIT)
                .map(raw -> parsePositiveInteger(raw, ENV_DOC_HISTORY_LIMIT))
                .orElse(DEFAULT_HISTORY_LIMIT);
        int webhookParallelism = env(ENV_WEBHOOK_PARALLELISM)
                .map(raw -> parsePositiveInteger(raw, ENV_WEBHOOK_PARALLELISM))
                .orElse(DEFAULT_WEBHOOK_PARALLELISM);

        Set<String> placeholderPageIds = env(ENV_PLACEHOLDER_PAGE_IDS)
                .map(ConfigLoader::parseList)
                .orElse(PlaceholderPolicy.DEFAULT_PAGE_IDS);
        Set<String> placeholderTitles = env(ENV_PLACEHOLDER_TITLES)
                .map(ConfigLoader::parseList)
                .orElse(PlaceholderPolicy.DEFAULT_TITLES);
        Set<String> placeholderVersions = env(ENV_PLACEHOLDER_VERSIONS)
                .map(ConfigLoader::parseList)
                .orElse(PlaceholderPolicy.DEFAULT_VERSIONS);
        boolean retrievedTokens = env(ENV_PLACEHOLDER_RETRIEVED_TOKENS)
                .map(raw -> parseBoolean(raw, ENV_PLACEHOLDER_RETRIEVED_TOKENS))
                .orElse(true);

        Secrets secrets = new Secrets(openAiApiKey, geminiApiKey, apiToken, env(ENV_WEBHOOK_SECRET));

        return new Config(engineConfig, confluence, repositoryPath, mainBranch, maxSteps, digestChars, historyLimit,
                placeholderPageIds, placeholderTitles, placeholderVersions, retrievedTokens, webhookParallelism,
                resolveLogFormat(arguments), secrets);
    }

    /**
     * Log format is resolved on its own so logging can be configured before the rest of the configuration loads.
     */
    public LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT).map(LogFormat::from).orElse(LogFormat.TEXT);
    }

    private int resolveMaxSteps(CliArguments arguments) {
        Integer cliValue = arguments.maxSteps();
        if (cliValue != null) {
            if (cliValue < 1) {
                throw new IllegalArgumentException("--max-steps must be at least 1");
            }
            return cliValue;
        }
        int value = env(ENV_AGENT_MAX_STEPS)
                .map(raw -> parsePositiveInteger(raw, ENV_AGENT_MAX_STEPS))
                .orElse(DEFAULT_MAX_STEPS);
        if (value < 1) {
            throw new IllegalArgumentException(ENV_AGENT_MAX_STEPS + " must be at least 1");
        }
        return value;
    }

    private Optional<String> env(String key) {
        return environmentReader.value(key);
    }

    private Optional<String> firstNonBlank(String cliValue, String envKey) {
        if (isNotBlank(cliValue)) {
            return Optional.of(cliValue.trim());
        }
        return env(envKey);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parsePositiveInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw, String key) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }

    private static boolean parseBoolean(String raw, String key) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalArgumentException(key + " must be true or false: " + raw);
        };
    }

    private static Set<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
