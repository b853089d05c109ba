package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionName;
import ai.docsite.autodoc.agent.tools.ActionRequest;
import ai.docsite.autodoc.logging.TaskLogger;
import ai.docsite.autodoc.task.ActionKind;
import ai.docsite.autodoc.task.DocumentationTask;
import ai.docsite.autodoc.task.Outcome;
import ai.docsite.autodoc.task.OutcomeStatus;
import ai.docsite.autodoc.task.TaskValidator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives one documentation task through retrieval, analysis and publish, gating each phase on its required
 * actions and recovering at most once per gated phase.
 */
public class DocumentationOrchestrator {

    private final TaskValidator validator;
    private final PhasePlanner planner;
    private final ReasoningSession session;
    private final ArgumentRepair argumentRepair;
    private final DirectiveFormatter formatter;

    public DocumentationOrchestrator(PhasePlanner planner, ReasoningSession session, ArgumentRepair argumentRepair) {
        this(planner, session, argumentRepair, DirectiveFormatter.DEFAULT_HISTORY_LIMIT,
                DirectiveFormatter.DEFAULT_DIGEST_CHARS);
    }

    public DocumentationOrchestrator(PhasePlanner planner,
                                     ReasoningSession session,
                                     ArgumentRepair argumentRepair,
                                     int historyLimit,
                                     int resultDigestChars) {
        this.validator = new TaskValidator();
        this.planner = Objects.requireNonNull(planner, "planner");
        this.session = Objects.requireNonNull(session, "session");
        this.argumentRepair = Objects.requireNonNull(argumentRepair, "argumentRepair");
        this.formatter = new DirectiveFormatter(historyLimit, resultDigestChars);
    }

    /**
     * @throws ai.docsite.autodoc.task.InvalidTaskException when required task fields are missing
     * @throws ai.docsite.autodoc.source.InvalidReferenceException when the commit id is malformed
     * @throws EngineUnavailableException when the engine cannot be reached
     * @throws ActionFailedException when a collaborator fails while publishing
     */
    public Outcome run(DocumentationTask task) {
        validator.validate(task);
        try (TaskLogger logger = TaskLogger.open(task.taskId(), task.actionKind().label())) {
            return run(task, logger);
        }
    }

    Outcome run(DocumentationTask task, TaskLogger logger) {
        PhasePlan plan = planner.plan(task);
        ExecutionState state = new ExecutionState();
        String system = formatter.system(task);
        logger.info("Starting {} task ({}) with {} of {} steps allocated",
                task.actionKind().label(), plan.variant(), plan.totalBudget(), planner.totalBudget());

        Phase retrieval = plan.phase(PhaseName.RETRIEVAL);
        logger.enterPhase(retrieval.name().label());
        String retrievalDirective = formatter.retrieval(task, plan.variant());
        runSession(SessionRequest.of(retrieval.name(), system, retrievalDirective,
                retrieval.stepBudget(), retrieval.forceAction()), state, logger);
        GateResult retrievalGate = checkGate(retrieval, system, retrievalDirective, state, logger);

        Phase analysis = plan.phase(PhaseName.ANALYSIS);
        logger.enterPhase(analysis.name().label());
        String analysisDirective = formatter.analysis(continuation(analysis, state.latestText()),
                retrievalGate.recoveryRan(), state.records());
        SessionResult analysisResult = runSession(SessionRequest.of(analysis.name(), system, analysisDirective,
                analysis.stepBudget(), analysis.forceAction()), state, logger);
        String documentation = analysisResult.text().isBlank() ? state.latestText() : analysisResult.text();

        Phase publish = plan.phase(PhaseName.PUBLISH);
        logger.enterPhase(publish.name().label());
        String publishSeed = continuation(publish, documentation);
        String publishDirective = formatter.publish(task, publishSeed, publish.requiredActions(), state.discovered());
        runSession(SessionRequest.of(publish.name(), system, publishDirective,
                publish.stepBudget(), publish.forceAction()), state, logger);
        String publishRecoveryDirective = formatter.publish(task, publishSeed, publish.requiredActions(),
                state.discovered());
        GateResult publishGate = checkGate(publish, system, publishRecoveryDirective, state, logger);

        Set<ActionName> residual = new LinkedHashSet<>(retrievalGate.missing());
        residual.addAll(publishGate.missing());
        List<ActionName> missing = plan.allRequiredActions().stream().filter(residual::contains).toList();
        Outcome outcome = outcome(task, plan, state, missing);
        logger.info("Task finished with status {}{}", outcome.status(),
                missing.isEmpty() ? "" : ", missing " + names(missing));
        return outcome;
    }

    private static String continuation(Phase phase, String priorText) {
        return phase.promptContinuation() ? priorText : "";
    }

    private SessionResult runSession(SessionRequest request, ExecutionState state, TaskLogger logger) {
        SessionRequest prepared = request.withRecordListener(state::record);
        if (request.phase() == PhaseName.PUBLISH) {
            prepared = prepared
                    .withArgumentInterceptor(actionRequest -> repair(actionRequest, state, logger))
                    .withPropagatedActionFailures();
        }
        SessionResult result = session.run(prepared, logger);
        state.updateLatestText(result.text());
        return result;
    }

    private ActionRequest repair(ActionRequest request, ExecutionState state, TaskLogger logger) {
        ActionRequest repaired = argumentRepair.repair(request, state.discovered());
        if (!repaired.equals(request)) {
            logger.info("Repaired placeholder arguments of {}: {} -> {}",
                    request.name(), request.arguments().get("pageId"), repaired.arguments().get("pageId"));
        }
        return repaired;
    }

    private GateResult checkGate(Phase phase, String system, String phaseDirective,
                                 ExecutionState state, TaskLogger logger) {
        List<ActionName> missing = missingActions(phase, state);
        if (missing.isEmpty()) {
            return new GateResult(List.of(), false);
        }
        logger.warn("{} phase did not execute {}; attempting recovery with {} step(s)",
                phase.name().label(), names(missing), phase.recoveryBudget());
        String directive = formatter.recovery(state.latestText(), phaseDirective, missing);
        runSession(SessionRequest.of(phase.name(), system, directive, phase.recoveryBudget(), true), state, logger);
        List<ActionName> residual = missingActions(phase, state);
        if (!residual.isEmpty()) {
            logger.warn("{} phase still missing {} after recovery", phase.name().label(), names(residual));
        }
        return new GateResult(residual, true);
    }

    private static List<ActionName> missingActions(Phase phase, ExecutionState state) {
        Set<ActionName> executed = state.executed(phase.name());
        return phase.requiredActions().stream().filter(action -> !executed.contains(action)).toList();
    }

    private static Outcome outcome(DocumentationTask task, PhasePlan plan, ExecutionState state, List<ActionName> missing) {
        Optional<DiscoveredEntities> written = state.latestWrite().map(record -> ExecutionState.pageFacts(record.result()));
        Optional<String> pageId = written.flatMap(DiscoveredEntities::pageId);
        Optional<String> pageTitle = written.flatMap(DiscoveredEntities::pageTitle);
        if (missing.isEmpty()) {
            String verb = task.isGenerate() ? "created" : "updated";
            return Outcome.completed(pageId, pageTitle,
                    "Documentation page " + pageId.orElse("(unknown)") + " " + verb);
        }
        boolean criticalMissing = missing.stream().anyMatch(ActionName::isPublishCritical);
        if (criticalMissing && task.actionKind() == ActionKind.UPDATE) {
            boolean partial = missing.size() != plan.allRequiredActions().size();
            return new Outcome(false, partial, OutcomeStatus.INCOMPLETE_UPDATE, missing, pageId, pageTitle,
                    "Update could not be confirmed; missing " + names(missing));
        }
        return new Outcome(false, true, OutcomeStatus.PARTIAL_COMPLETION, missing, pageId, pageTitle,
                "Completed partially; missing " + names(missing));
    }

    private static String names(List<ActionName> actions) {
        return actions.stream().map(ActionName::wireName).collect(Collectors.joining(", "));
    }

    private record GateResult(List<ActionName> missing, boolean recoveryRan) {
    }
}
