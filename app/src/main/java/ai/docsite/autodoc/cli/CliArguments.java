package ai.docsite.autodoc.cli;

import ai.docsite.autodoc.config.LogFormat;
import ai.docsite.autodoc.task.ActionKind;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-docsite-autodoc", mixinStandardHelpOptions = true,
        description = "Generates and updates Confluence documentation pages from source code")
public class CliArguments {

    @CommandLine.Option(names = "--action", converter = ActionKindConverter.class, description = "Task action: generate or update")
    private ActionKind action;

    @CommandLine.Option(names = "--file", description = "Source file to document (generate)", paramLabel = "PATH")
    private String filePath;

    @CommandLine.Option(names = "--commit", description = "Commit whose changes should be documented (update)", paramLabel = "SHA")
    private String commitId;

    @CommandLine.Option(names = "--page-id", description = "Existing documentation page to update", paramLabel = "ID")
    private String pageId;

    @CommandLine.Option(names = "--space-id", description = "Confluence space for documentation pages", paramLabel = "ID")
    private String spaceId;

    @CommandLine.Option(names = "--parent-page-id", description = "Parent page for newly created pages", paramLabel = "ID")
    private String parentPageId;

    @CommandLine.Option(names = "--webhook-payload", description = "Process a push event payload stored in this file", paramLabel = "FILE")
    private Path webhookPayload;

    @CommandLine.Option(names = "--webhook-signature", description = "X-Hub-Signature-256 header sent with the payload", paramLabel = "SIGNATURE")
    private String webhookSignature;

    @CommandLine.Option(names = "--max-steps", description = "Total reasoning step budget per task", paramLabel = "COUNT")
    private Integer maxSteps;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--repo", description = "Path of the local git repository", paramLabel = "DIR")
    private Path repositoryPath;

    public ActionKind action() {
        return action;
    }

    public String filePath() {
        return filePath;
    }

    public String commitId() {
        return commitId;
    }

    public String pageId() {
        return pageId;
    }

    public String spaceId() {
        return spaceId;
    }

    public String parentPageId() {
        return parentPageId;
    }

    public Path webhookPayload() {
        return webhookPayload;
    }

    public String webhookSignature() {
        return webhookSignature;
    }

    public Integer maxSteps() {
        return maxSteps;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public Path repositoryPath() {
        return repositoryPath;
    }
}
