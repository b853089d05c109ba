package ai.docsite.autodoc.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.docsite.autodoc.cli.CliArguments;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void appliesDefaultsOnTopOfRequiredValues() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(new RecordingEnvironmentReader(required())).load(cliArguments);

        assertThat(config.engineConfig().provider()).isEqualTo(LlmProvider.OPENAI);
        assertThat(config.engineConfig().modelName()).isEqualTo("gpt-4o-mini");
        assertThat(config.engineConfig().baseUrl()).isEmpty();
        assertThat(config.engineConfig().temperature()).isEqualTo(0.1);
        assertThat(config.engineConfig().timeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(config.confluence().baseUrl()).isEqualTo(URI.create("https://example.atlassian.net"));
        assertThat(config.confluence().spaceId()).isEmpty();
        assertThat(config.repositoryPath()).isEqualTo(Path.of("."));
        assertThat(config.mainBranch()).isEqualTo("main");
        assertThat(config.maxSteps()).isEqualTo(10);
        assertThat(config.resultDigestChars()).isEqualTo(4000);
        assertThat(config.historyLimit()).isEqualTo(15);
        assertThat(config.webhookParallelism()).isEqualTo(2);
        assertThat(config.placeholderPageIds()).contains("123", "[Retrieved pageId]");
        assertThat(config.placeholderRetrievedTokens()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.secrets().openAiApiKey()).contains("sk-test");
        assertThat(config.secrets().toString()).doesNotContain("sk-test").doesNotContain("confluence-token");
    }

    @Test
    void cliArgumentsOverrideEnvironment() {
        Map<String, String> env = required();
        env.put(ConfigLoader.ENV_SPACE_ID, "ENVSPACE");
        env.put(ConfigLoader.ENV_AGENT_MAX_STEPS, "8");
        env.put(ConfigLoader.ENV_LOG_FORMAT, "text");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--space-id", "CLISPACE",
                "--parent-page-id", "100",
                "--max-steps", "20",
                "--log-format", "json",
                "--repo", "/srv/repo");

        Config config = new ConfigLoader(new RecordingEnvironmentReader(env)).load(cliArguments);

        assertThat(config.confluence().spaceId()).contains("CLISPACE");
        assertThat(config.confluence().parentPageId()).contains("100");
        assertThat(config.maxSteps()).isEqualTo(20);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.repositoryPath()).isEqualTo(Path.of("/srv/repo"));
    }

    @Test
    void readsOptionalSettingsFromEnvironment() {
        Map<String, String> env = required();
        env.remove(ConfigLoader.ENV_OPENAI_API_KEY);
        env.put(ConfigLoader.ENV_LLM_PROVIDER, "ollama");
        env.put(ConfigLoader.ENV_LLM_MODEL, "qwen2.5");
        env.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        env.put(ConfigLoader.ENV_LLM_TEMPERATURE, "0.4");
        env.put(ConfigLoader.ENV_GIT_MAIN_BRANCH, "trunk");
        env.put(ConfigLoader.ENV_WEBHOOK_SECRET, "hook-secret");
        env.put(ConfigLoader.ENV_WEBHOOK_PARALLELISM, "4");
        env.put(ConfigLoader.ENV_PLACEHOLDER_PAGE_IDS, "PAGE_ID, 999 ,");
        env.put(ConfigLoader.ENV_PLACEHOLDER_RETRIEVED_TOKENS, "false");
        env.put(ConfigLoader.ENV_DOC_HISTORY_LIMIT, "5");

        Config config = new ConfigLoader(new RecordingEnvironmentReader(env))
                .load(CommandLine.populateCommand(new CliArguments()));

        assertThat(config.engineConfig().isOllama()).isTrue();
        assertThat(config.engineConfig().modelName()).isEqualTo("qwen2.5");
        assertThat(config.engineConfig().baseUrl()).contains("http://ollama:11434");
        assertThat(config.engineConfig().temperature()).isEqualTo(0.4);
        assertThat(config.mainBranch()).isEqualTo("trunk");
        assertThat(config.secrets().webhookSecret()).contains("hook-secret");
        assertThat(config.webhookParallelism()).isEqualTo(4);
        assertThat(config.placeholderPageIds()).containsExactlyInAnyOrder("PAGE_ID", "999");
        assertThat(config.placeholderRetrievedTokens()).isFalse();
        assertThat(config.historyLimit()).isEqualTo(5);
    }

    @Test
    void missingProviderKeyFails() {
        Map<String, String> env = required();
        env.remove(ConfigLoader.ENV_OPENAI_API_KEY);

        Throwable thrown = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(env))
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    void missingConfluenceTokenFails() {
        Map<String, String> env = required();
        env.remove(ConfigLoader.ENV_CONFLUENCE_API_TOKEN);

        Throwable thrown = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(env))
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessageContaining("CONFLUENCE_API_TOKEN");
    }

    @Test
    void blankEnvironmentValuesCountAsUnset() {
        Map<String, String> env = required();
        env.put(ConfigLoader.ENV_CONFLUENCE_API_TOKEN, "   ");
        env.put(ConfigLoader.ENV_GIT_MAIN_BRANCH, "");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(env))
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessageContaining("CONFLUENCE_API_TOKEN");
        assertThat(new RecordingEnvironmentReader(Map.of("KEY", "  value ")).value("KEY")).contains("value");
    }

    @Test
    void invalidNumbersAreReported() {
        Map<String, String> env = required();
        env.put(ConfigLoader.ENV_AGENT_MAX_STEPS, "many");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(env))
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("AGENT_MAX_STEPS");
    }

    @Test
    void zeroMaxStepsIsRejected() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(required()))
                .load(CommandLine.populateCommand(new CliArguments(), "--max-steps", "0")));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--max-steps");
    }

    @Test
    void logFormatResolvesWithoutOtherSettings() {
        RecordingEnvironmentReader environmentReader =
                new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_LOG_FORMAT, "json"));

        LogFormat format = new ConfigLoader(environmentReader)
                .resolveLogFormat(CommandLine.populateCommand(new CliArguments()));

        assertThat(format).isEqualTo(LogFormat.JSON);
        assertThat(environmentReader.requestedKeys()).containsExactly(ConfigLoader.ENV_LOG_FORMAT);
    }

    private static Map<String, String> required() {
        Map<String, String> env = new HashMap<>();
        env.put(ConfigLoader.ENV_OPENAI_API_KEY, "sk-test");
        env.put(ConfigLoader.ENV_CONFLUENCE_BASE_URL, "https://example.atlassian.net");
        env.put(ConfigLoader.ENV_CONFLUENCE_EMAIL, "bot@example.com");
        env.put(ConfigLoader.ENV_CONFLUENCE_API_TOKEN, "confluence-token");
        return env;
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
