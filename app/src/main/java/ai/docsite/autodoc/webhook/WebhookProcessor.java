package ai.docsite.autodoc.webhook;

import ai.docsite.autodoc.task.DocumentationTask;
import ai.docsite.autodoc.task.Outcome;
import ai.docsite.autodoc.webhook.WebhookResult.CommitResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a push delivery into one update task per pushed commit.
 */
public class WebhookProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookProcessor.class);

    private final Function<DocumentationTask, Outcome> taskRunner;
    private final WebhookSignatureVerifier verifier;
    private final Set<String> acceptedBranches;
    private final String spaceId;
    private final String parentPageId;
    private final int parallelism;
    private final ObjectMapper objectMapper;

    public WebhookProcessor(Function<DocumentationTask, Outcome> taskRunner,
                            WebhookSignatureVerifier verifier,
                            String mainBranch,
                            String spaceId,
                            String parentPageId,
                            int parallelism) {
        this(taskRunner, verifier, mainBranch, spaceId, parentPageId, parallelism, new ObjectMapper());
    }

    WebhookProcessor(Function<DocumentationTask, Outcome> taskRunner,
                     WebhookSignatureVerifier verifier,
                     String mainBranch,
                     String spaceId,
                     String parentPageId,
                     int parallelism,
                     ObjectMapper objectMapper) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.taskRunner = Objects.requireNonNull(taskRunner, "taskRunner");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.acceptedBranches = new LinkedHashSet<>(List.of("main", "master"));
        if (mainBranch != null && !mainBranch.isBlank()) {
            acceptedBranches.add(mainBranch.trim());
        }
        this.spaceId = spaceId;
        this.parentPageId = parentPageId;
        this.parallelism = parallelism;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public WebhookResult process(String rawBody, String signatureHeader) {
        String body = Objects.requireNonNullElse(rawBody, "");
        if (!verifier.verify(body.getBytes(StandardCharsets.UTF_8), signatureHeader)) {
            LOGGER.warn("Rejected webhook delivery with invalid signature");
            return WebhookResult.rejected("Invalid webhook signature");
        }
        PushEvent event;
        try {
            event = objectMapper.readValue(body, PushEvent.class);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Rejected malformed webhook payload: {}", ex.getOriginalMessage());
            return WebhookResult.rejected("Malformed push payload");
        }
        if (!acceptedBranches.contains(event.branch())) {
            LOGGER.info("Ignoring push to {}", event.ref());
            return WebhookResult.ignored("Push to " + event.ref() + " is not on a documented branch");
        }
        List<String> commitIds = event.commits().stream()
                .map(PushEvent.Commit::id)
                .filter(Objects::nonNull)
                .toList();
        if (commitIds.isEmpty()) {
            return WebhookResult.ignored("Push contains no commits");
        }
        LOGGER.info("Processing {} commit(s) pushed to {}", commitIds.size(), event.branch());
        return new WebhookResult(WebhookResult.Status.PROCESSED,
                "Processed " + commitIds.size() + " commit(s)", runAll(commitIds));
    }

    private List<CommitResult> runAll(List<String> commitIds) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, commitIds.size()));
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (String commitId : commitIds) {
                DocumentationTask task = DocumentationTask.update(spaceId, commitId, null, parentPageId);
                futures.add(executor.submit(() -> taskRunner.apply(task)));
            }
            List<CommitResult> results = new ArrayList<>();
            for (int i = 0; i < commitIds.size(); i++) {
                results.add(await(commitIds.get(i), futures.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private CommitResult await(String commitId, Future<Outcome> future) {
        try {
            return CommitResult.of(commitId, future.get());
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            LOGGER.error("Documentation update failed for commit {}", commitId, cause);
            return CommitResult.failed(commitId, String.valueOf(cause.getMessage()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return CommitResult.failed(commitId, "Interrupted while waiting for task");
        }
    }
}
