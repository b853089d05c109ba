package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionExecutor;
import ai.docsite.autodoc.agent.tools.ActionName;
import ai.docsite.autodoc.agent.tools.ActionRegistry;
import ai.docsite.autodoc.agent.tools.ActionRequest;
import ai.docsite.autodoc.agent.tools.ActionResult;
import ai.docsite.autodoc.logging.TaskLogger;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ToolChoice;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one bounded tool-calling conversation with the chat model. Every requested action is executed in order
 * and its result is fed back before the next round.
 */
public class ReasoningSession {

    static final String FORCE_ACTION_INSTRUCTION =
            "You MUST call at least one of the available actions now. Do not answer before you have gathered data.";

    private final ChatModel chatModel;
    private final ActionRegistry registry;
    private final ActionExecutor executor;
    private final boolean requiredToolChoiceSupported;

    public ReasoningSession(ChatModel chatModel, ActionRegistry registry, ActionExecutor executor) {
        this(chatModel, registry, executor, true);
    }

    /**
     * @param requiredToolChoiceSupported whether the provider honours {@link ToolChoice#REQUIRED}; when it does
     *                                    not, forcing falls back to an instruction in the user message
     */
    public ReasoningSession(ChatModel chatModel,
                            ActionRegistry registry,
                            ActionExecutor executor,
                            boolean requiredToolChoiceSupported) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.requiredToolChoiceSupported = requiredToolChoiceSupported;
    }

    public SessionResult run(SessionRequest request, TaskLogger logger) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(logger, "logger");
        if (request.budget() == 0) {
            logger.info("Skipping {} session: no budget", request.phase().label());
            return SessionResult.empty();
        }

        boolean forceWithToolChoice = request.forceAction() && requiredToolChoiceSupported;
        String userDirective = request.forceAction() && !requiredToolChoiceSupported
                ? request.userDirective() + "\n\n" + FORCE_ACTION_INSTRUCTION
                : request.userDirective();

        List<ChatMessage> messages = new ArrayList<>();
        if (!request.systemDirective().isBlank()) {
            messages.add(SystemMessage.from(request.systemDirective()));
        }
        messages.add(UserMessage.from(userDirective));

        List<ActionInvocationRecord> records = new ArrayList<>();
        String text = "";
        int round = 0;
        while (round < request.budget()) {
            round++;
            AiMessage reply = ask(messages, round == 1 && forceWithToolChoice, request.phase(), round);
            if (reply.text() != null && !reply.text().isBlank()) {
                text = reply.text();
            }
            if (!reply.hasToolExecutionRequests()) {
                logger.debug("{} session finished after {} round(s) with {} action(s)",
                        request.phase().label(), round, records.size());
                return new SessionResult(text, records, round);
            }
            messages.add(reply);
            for (ToolExecutionRequest toolRequest : reply.toolExecutionRequests()) {
                messages.add(execute(toolRequest, request, records, logger));
            }
        }
        logger.info("{} session used its full budget of {} round(s)", request.phase().label(), request.budget());
        return new SessionResult(text, records, round);
    }

    private AiMessage ask(List<ChatMessage> messages, boolean requireAction, PhaseName phase, int round) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(List.copyOf(messages))
                .toolSpecifications(registry.specifications());
        if (requireAction) {
            builder.toolChoice(ToolChoice.REQUIRED);
        }
        ChatResponse response;
        try {
            response = chatModel.chat(builder.build());
        } catch (RuntimeException ex) {
            throw new EngineUnavailableException("Reasoning engine call failed in " + phase.label()
                    + " round " + round + ": " + ex.getMessage(), ex);
        }
        if (response == null || response.aiMessage() == null) {
            throw new EngineUnavailableException("Reasoning engine returned no message in " + phase.label()
                    + " round " + round);
        }
        return response.aiMessage();
    }

    private ToolExecutionResultMessage execute(ToolExecutionRequest toolRequest,
                                               SessionRequest request,
                                               List<ActionInvocationRecord> records,
                                               TaskLogger logger) {
        Optional<ActionName> name = ActionName.fromWireName(toolRequest.name());
        if (name.isEmpty()) {
            logger.warn("Engine requested unknown action {}", toolRequest.name());
            return ToolExecutionResultMessage.from(toolRequest,
                    "{\"error\":\"Unknown action: " + sanitize(toolRequest.name()) + "\"}");
        }

        Map<String, Object> arguments;
        try {
            arguments = executor.parseArguments(toolRequest.arguments());
        } catch (IllegalArgumentException ex) {
            logger.warn("Engine sent unreadable arguments for {}: {}", name.get(), ex.getMessage());
            String error = "{\"error\":\"Arguments must be a JSON object\"}";
            append(new ActionInvocationRecord(request.phase(), name.get(), Map.of(), error, true), request, records);
            return ToolExecutionResultMessage.from(toolRequest, error);
        }

        ActionRequest actionRequest = request.argumentInterceptor()
                .apply(new ActionRequest(toolRequest.id(), name.get(), arguments));
        logger.info("Executing {} in {}", actionRequest.name(), request.phase().label());
        ActionResult result = executor.execute(actionRequest);
        append(new ActionInvocationRecord(request.phase(), actionRequest.name(), actionRequest.arguments(),
                result.text(), result.error()), request, records);

        if (result.failure().isPresent() && request.propagateActionFailures()) {
            throw new ActionFailedException(actionRequest.name(), result.failure().get());
        }
        return ToolExecutionResultMessage.from(toolRequest, result.text());
    }

    private static void append(ActionInvocationRecord record, SessionRequest request, List<ActionInvocationRecord> records) {
        records.add(record);
        request.recordListener().accept(record);
    }

    private static String sanitize(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
