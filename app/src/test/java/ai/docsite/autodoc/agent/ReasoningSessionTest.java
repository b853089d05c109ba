package ai.docsite.autodoc.agent;

import static ai.docsite.autodoc.support.ScriptedChatModel.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.docsite.autodoc.agent.tools.ActionExecutor;
import ai.docsite.autodoc.agent.tools.ActionName;
import ai.docsite.autodoc.agent.tools.ActionRegistry;
import ai.docsite.autodoc.logging.TaskLogger;
import ai.docsite.autodoc.markup.MarkupConverter;
import ai.docsite.autodoc.page.PageNotFoundException;
import ai.docsite.autodoc.support.ScriptedChatModel;
import ai.docsite.autodoc.support.StubPageStore;
import ai.docsite.autodoc.support.StubSourceReader;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ToolChoice;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ReasoningSessionTest {

    private final ScriptedChatModel model = new ScriptedChatModel();
    private final StubSourceReader sourceReader = new StubSourceReader().withFile("src/app.ts", "export {}");
    private final StubPageStore pageStore = new StubPageStore();
    private final TaskLogger logger = TaskLogger.open("task-1", "generate");

    @AfterEach
    void closeLogger() {
        logger.close();
    }

    @Test
    void forcesOnlyTheFirstRound() {
        model.thenCall(call("read-file", "{\"path\":\"src/app.ts\"}")).thenAnswer("Read it.");

        SessionResult result = session(true).run(
                SessionRequest.of(PhaseName.RETRIEVAL, "system", "gather", 4, true), logger);

        assertThat(result.text()).isEqualTo("Read it.");
        assertThat(result.rounds()).isEqualTo(2);
        assertThat(result.records()).singleElement().satisfies(record -> {
            assertThat(record.actionName()).isEqualTo(ActionName.READ_FILE);
            assertThat(record.phase()).isEqualTo(PhaseName.RETRIEVAL);
            assertThat(record.error()).isFalse();
            assertThat(record.result()).contains("export {}");
        });
        assertThat(model.requests().get(0).toolChoice()).isEqualTo(ToolChoice.REQUIRED);
        assertThat(model.requests().get(1).toolChoice()).isNull();
        assertThat(model.requests().get(0).toolSpecifications()).hasSize(ActionName.values().length);
        assertThat(model.requests().get(0).messages().get(0)).isInstanceOf(SystemMessage.class);
    }

    @Test
    void instructsProvidersWithoutToolChoiceToCallAnAction() {
        model.thenAnswer("ok");

        session(false).run(SessionRequest.of(PhaseName.RETRIEVAL, "", "gather", 2, true), logger);

        List<ChatMessage> messages = model.requests().get(0).messages();
        assertThat(model.requests().get(0).toolChoice()).isNull();
        assertThat(messages).singleElement().isInstanceOf(UserMessage.class);
        assertThat(((UserMessage) messages.get(0)).singleText())
                .startsWith("gather")
                .endsWith(ReasoningSession.FORCE_ACTION_INSTRUCTION);
    }

    @Test
    void zeroBudgetSkipsEngine() {
        SessionResult result = session(true).run(
                SessionRequest.of(PhaseName.ANALYSIS, "system", "write", 0, false), logger);

        assertThat(result.records()).isEmpty();
        assertThat(result.rounds()).isZero();
        assertThat(model.requests()).isEmpty();
    }

    @Test
    void stopsWhenBudgetIsExhausted() {
        model.thenCall(call("read-file", "{\"path\":\"src/app.ts\"}"))
                .thenCall(call("read-file", "{\"path\":\"src/app.ts\"}"))
                .thenCall(call("read-file", "{\"path\":\"src/app.ts\"}"));

        SessionResult result = session(true).run(
                SessionRequest.of(PhaseName.RETRIEVAL, "system", "gather", 2, false), logger);

        assertThat(result.rounds()).isEqualTo(2);
        assertThat(result.records()).hasSize(2);
        assertThat(model.remaining()).isEqualTo(1);
    }

    @Test
    void unknownActionIsAnsweredWithErrorAndNotRecorded() {
        model.thenCall(call("delete-everything", "{}")).thenAnswer("sorry");

        SessionResult result = session(true).run(
                SessionRequest.of(PhaseName.RETRIEVAL, "system", "gather", 3, false), logger);

        assertThat(result.records()).isEmpty();
        ToolExecutionResultMessage toolResult = lastToolResult(model.requests().get(1).messages());
        assertThat(toolResult.text()).contains("Unknown action: delete-everything");
    }

    @Test
    void malformedArgumentsBecomeErrorRecord() {
        model.thenCall(call("read-file", "not json")).thenAnswer("sorry");

        SessionResult result = session(true).run(
                SessionRequest.of(PhaseName.RETRIEVAL, "system", "gather", 3, false), logger);

        assertThat(result.records()).singleElement().satisfies(record -> {
            assertThat(record.error()).isTrue();
            assertThat(record.arguments()).isEmpty();
        });
    }

    @Test
    void collaboratorFailureIsReportedToEngineUnlessPropagated() {
        model.thenCall(call("get-page", "{\"pageId\":\"999\"}")).thenAnswer("page missing");

        SessionResult result = session(true).run(
                SessionRequest.of(PhaseName.RETRIEVAL, "system", "gather", 3, false), logger);

        assertThat(result.records()).singleElement().satisfies(record -> {
            assertThat(record.error()).isTrue();
            assertThat(record.result()).contains("999");
        });
        assertThat(lastToolResult(model.requests().get(1).messages()).text()).contains("\"error\"");
    }

    @Test
    void propagatedCollaboratorFailureAbortsSession() {
        model.thenCall(call("get-page", "{\"pageId\":\"999\"}"));
        List<ActionInvocationRecord> seen = new ArrayList<>();

        Throwable thrown = catchThrowable(() -> session(true).run(
                SessionRequest.of(PhaseName.PUBLISH, "system", "publish", 3, true)
                        .withPropagatedActionFailures()
                        .withRecordListener(seen::add), logger));

        assertThat(thrown).isInstanceOf(ActionFailedException.class).hasCauseInstanceOf(PageNotFoundException.class);
        assertThat(seen).hasSize(1);
    }

    @Test
    void interceptorRewritesArgumentsBeforeExecution() {
        pageStore.withPage("42", "Real", 2, "<p/>");
        model.thenCall(call("get-page", "{\"pageId\":\"123\"}")).thenAnswer("done");

        SessionResult result = session(true).run(
                SessionRequest.of(PhaseName.PUBLISH, "system", "publish", 2, false)
                        .withArgumentInterceptor(request -> request.withArguments(Map.of("pageId", "42"))), logger);

        assertThat(result.records()).singleElement().satisfies(record -> {
            assertThat(record.arguments()).containsEntry("pageId", "42");
            assertThat(record.error()).isFalse();
        });
    }

    @Test
    void missingEngineMessageMeansEngineUnavailable() {
        model.thenReply(request -> null);

        Throwable thrown = catchThrowable(() -> session(true).run(
                SessionRequest.of(PhaseName.ANALYSIS, "system", "write", 2, false), logger));

        assertThat(thrown).isInstanceOf(EngineUnavailableException.class).hasMessageContaining("analysis");
    }

    private ReasoningSession session(boolean requiredToolChoice) {
        ActionExecutor executor = new ActionExecutor(sourceReader, pageStore, new MarkupConverter());
        return new ReasoningSession(model, new ActionRegistry(), executor, requiredToolChoice);
    }

    private static ToolExecutionResultMessage lastToolResult(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i) instanceof ToolExecutionResultMessage result) {
                return result;
            }
        }
        throw new AssertionError("No tool result in conversation");
    }
}
