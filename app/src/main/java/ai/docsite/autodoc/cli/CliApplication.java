package ai.docsite.autodoc.cli;

import ai.docsite.autodoc.agent.ArgumentRepair;
import ai.docsite.autodoc.agent.DocumentationOrchestrator;
import ai.docsite.autodoc.agent.PhasePlanner;
import ai.docsite.autodoc.agent.PlaceholderPolicy;
import ai.docsite.autodoc.agent.ReasoningSession;
import ai.docsite.autodoc.agent.tools.ActionExecutor;
import ai.docsite.autodoc.agent.tools.ActionRegistry;
import ai.docsite.autodoc.config.Config;
import ai.docsite.autodoc.config.ConfigLoader;
import ai.docsite.autodoc.config.EngineConfig;
import ai.docsite.autodoc.config.Secrets;
import ai.docsite.autodoc.config.SystemEnvironmentReader;
import ai.docsite.autodoc.logging.LoggingConfigurator;
import ai.docsite.autodoc.markup.MarkupConverter;
import ai.docsite.autodoc.page.ConfluencePageStore;
import ai.docsite.autodoc.source.GitSourceReader;
import ai.docsite.autodoc.source.InvalidReferenceException;
import ai.docsite.autodoc.task.DocumentationTask;
import ai.docsite.autodoc.task.InvalidTaskException;
import ai.docsite.autodoc.task.Outcome;
import ai.docsite.autodoc.webhook.WebhookProcessor;
import ai.docsite.autodoc.webhook.WebhookResult;
import ai.docsite.autodoc.webhook.WebhookSignatureVerifier;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the documentation orchestrator.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INCOMPLETE = 1;
    static final int EXIT_INVALID_INPUT = 2;
    static final int EXIT_RUNTIME_FAILURE = 3;

    private final ConfigLoader configLoader;
    private final Function<Config, DocumentationOrchestrator> orchestratorFactory;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createOrchestrator,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader,
                   Function<Config, DocumentationOrchestrator> orchestratorFactory,
                   PrintWriter out,
                   PrintWriter err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.orchestratorFactory = Objects.requireNonNull(orchestratorFactory, "orchestratorFactory");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments).setOut(out).setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return EXIT_INVALID_INPUT;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }
        if (cliArguments.action() == null && cliArguments.webhookPayload() == null) {
            err.println("Either --action or --webhook-payload must be provided");
            commandLine.usage(err);
            return EXIT_INVALID_INPUT;
        }

        Config config;
        try {
            LoggingConfigurator.configure(configLoader.resolveLogFormat(cliArguments));
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            err.println("Invalid configuration: " + ex.getMessage());
            return EXIT_INVALID_INPUT;
        }
        LOGGER.info("Using {} model '{}' against repository {} ({})", config.engineConfig().provider(),
                config.engineConfig().modelName(), config.repositoryPath(), config.mainBranch());

        DocumentationOrchestrator orchestrator;
        try {
            orchestrator = orchestratorFactory.apply(config);
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to initialize documentation pipeline", ex);
            err.println("Initialization failed: " + ex.getMessage());
            return EXIT_RUNTIME_FAILURE;
        }

        if (cliArguments.webhookPayload() != null) {
            return runWebhook(cliArguments, config, orchestrator);
        }
        return runTask(buildTask(cliArguments, config), orchestrator);
    }

    private int runTask(DocumentationTask task, DocumentationOrchestrator orchestrator) {
        Outcome outcome;
        try {
            outcome = orchestrator.run(task);
        } catch (InvalidTaskException | InvalidReferenceException ex) {
            err.println("Invalid task: " + ex.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (RuntimeException ex) {
            LOGGER.error("Task {} failed", task.taskId(), ex);
            err.println("Task failed: " + ex.getMessage());
            return EXIT_RUNTIME_FAILURE;
        }
        printOutcome(task.taskId(), outcome);
        return outcome.success() ? EXIT_OK : EXIT_INCOMPLETE;
    }

    private int runWebhook(CliArguments arguments, Config config, DocumentationOrchestrator orchestrator) {
        String body;
        try {
            body = Files.readString(arguments.webhookPayload(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            err.println("Unable to read webhook payload " + arguments.webhookPayload() + ": " + ex.getMessage());
            return EXIT_INVALID_INPUT;
        }
        WebhookProcessor processor = new WebhookProcessor(orchestrator::run,
                new WebhookSignatureVerifier(config.secrets().webhookSecret()),
                config.mainBranch(),
                config.confluence().spaceId().orElse(""),
                config.confluence().parentPageId().orElse(null),
                config.webhookParallelism());
        WebhookResult result = processor.process(body, arguments.webhookSignature());
        out.println("webhook " + result.status() + ": " + result.message());
        for (WebhookResult.CommitResult commit : result.commits()) {
            commit.outcome().ifPresent(outcome -> printOutcome(commit.commitId(), outcome));
            commit.error().ifPresent(error -> out.println(commit.commitId() + " ERROR: " + error));
        }
        return switch (result.status()) {
            case REJECTED -> EXIT_INVALID_INPUT;
            case IGNORED -> EXIT_OK;
            case PROCESSED -> result.allSucceeded() ? EXIT_OK : EXIT_INCOMPLETE;
        };
    }

    private static DocumentationTask buildTask(CliArguments arguments, Config config) {
        String spaceId = config.confluence().spaceId().orElse("");
        String parentPageId = config.confluence().parentPageId().orElse(null);
        return switch (arguments.action()) {
            case GENERATE -> DocumentationTask.generate(spaceId, arguments.filePath(), parentPageId);
            case UPDATE -> DocumentationTask.update(spaceId, arguments.commitId(), arguments.pageId(), parentPageId);
        };
    }

    private void printOutcome(String label, Outcome outcome) {
        out.printf("%s %s: %s%n", label, outcome.status(), outcome.message());
        outcome.pageId().ifPresent(pageId -> out.println("  pageId: " + pageId));
        outcome.pageTitle().ifPresent(title -> out.println("  title: " + title));
        if (!outcome.missingActions().isEmpty()) {
            out.println("  missing: " + outcome.missingActions());
        }
    }

    static DocumentationOrchestrator createOrchestrator(Config config) {
        ChatModel chatModel = createChatModel(config.engineConfig(), config.secrets());
        GitSourceReader sourceReader = new GitSourceReader(config.repositoryPath(), config.mainBranch());
        ConfluencePageStore pageStore = new ConfluencePageStore(config.confluence().baseUrl(),
                config.confluence().email(), config.secrets().confluenceApiToken());
        ActionExecutor executor = new ActionExecutor(sourceReader, pageStore, new MarkupConverter());
        ReasoningSession session = new ReasoningSession(chatModel, new ActionRegistry(), executor,
                config.engineConfig().provider().supportsRequiredToolChoice());
        PlaceholderPolicy placeholders = new PlaceholderPolicy(config.placeholderPageIds(),
                config.placeholderTitles(), config.placeholderVersions(), config.placeholderRetrievedTokens());
        return new DocumentationOrchestrator(new PhasePlanner(config.maxSteps()), session,
                new ArgumentRepair(placeholders), config.historyLimit(), config.resultDigestChars());
    }

    private static ChatModel createChatModel(EngineConfig engineConfig, Secrets secrets) {
        return switch (engineConfig.provider()) {
            case OPENAI -> createOpenAiChatModel(engineConfig, secrets);
            case GEMINI -> createGeminiChatModel(engineConfig, secrets);
            case OLLAMA -> createOllamaChatModel(engineConfig);
        };
    }

    private static ChatModel createOpenAiChatModel(EngineConfig engineConfig, Secrets secrets) {
        String apiKey = secrets.openAiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("OPENAI_API_KEY must be provided when LLM_PROVIDER=openai"));
        try {
            LOGGER.info("Using OpenAI model '{}'", engineConfig.modelName());
            return OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(engineConfig.modelName())
                    .temperature(engineConfig.temperature())
                    .timeout(engineConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize OpenAI chat model", ex);
        }
    }

    private static ChatModel createOllamaChatModel(EngineConfig engineConfig) {
        try {
            String baseUrl = engineConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", engineConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(engineConfig.modelName())
                    .temperature(engineConfig.temperature())
                    .timeout(engineConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(EngineConfig engineConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", engineConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(engineConfig.modelName())
                    .temperature(engineConfig.temperature())
                    .timeout(engineConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
