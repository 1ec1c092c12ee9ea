package org.javai.sqlpilot.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.javai.sqlpilot.analyze.Analysis;
import org.javai.sqlpilot.analyze.ResultAnalyzer;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.correct.Correction;
import org.javai.sqlpilot.correct.QueryCorrector;
import org.javai.sqlpilot.exec.ExecutionOutcome;
import org.javai.sqlpilot.exec.QueryExecutor;
import org.javai.sqlpilot.metrics.RoundOutcome;
import org.javai.sqlpilot.reduce.SchemaContextReducer;
import org.javai.sqlpilot.route.ComplexityRouter;
import org.javai.sqlpilot.synth.QuerySynthesizer;
import org.javai.sqlpilot.synth.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one question through reduce, route, generate, execute/analyze and fix.
 *
 * <pre>
 *   GENERATE ──► EXECUTE_ANALYZE ──► SUCCEEDED
 *                  │      ▲
 *                  ▼      │
 *                  FIX ───┘          (attempts &lt; budget)
 *                  │
 *                  └──────────────► FAILED   (budget spent, forbidden, abandoned)
 * </pre>
 *
 * <p>Only GENERATE and FIX consume attempts, and EXECUTE_ANALYZE moves to FIX only while attempts remain, so a run
 * ends after at most {@code attemptBudget} rounds whatever the collaborators return. Forbidden queries and a
 * missing schema end the run at once.</p>
 *
 * <p>The supervisor keeps no per-request state of its own and can serve many requests concurrently.</p>
 */
public final class Supervisor {

	private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

	private static final List<String> UNKNOWN_IDENTIFIER_MARKERS = List.of(
			"unknown", "does not exist", "invalid identifier", "no such column", "no such table");

	private final SchemaContextReducer reducer;
	private final ComplexityRouter router;
	private final QuerySynthesizer synthesizer;
	private final QueryExecutor executor;
	private final ResultAnalyzer analyzer;
	private final QueryCorrector corrector;
	private final int attemptBudget;
	private final double successThreshold;
	private final int rowCap;
	private final Duration executionTimeBudget;

	public Supervisor(SchemaContextReducer reducer, ComplexityRouter router, QuerySynthesizer synthesizer,
			QueryExecutor executor, ResultAnalyzer analyzer, QueryCorrector corrector, int attemptBudget,
			double successThreshold, int rowCap, Duration executionTimeBudget) {
		this.reducer = Objects.requireNonNull(reducer, "reducer must not be null");
		this.router = Objects.requireNonNull(router, "router must not be null");
		this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
		this.corrector = Objects.requireNonNull(corrector, "corrector must not be null");
		this.executionTimeBudget = Objects.requireNonNull(executionTimeBudget, "executionTimeBudget must not be null");
		if (attemptBudget < 1) {
			throw new IllegalArgumentException("attemptBudget must be >= 1");
		}
		if (rowCap < 1) {
			throw new IllegalArgumentException("rowCap must be >= 1");
		}
		this.attemptBudget = attemptBudget;
		this.successThreshold = successThreshold;
		this.rowCap = rowCap;
	}

	/**
	 * Runs the state machine to a terminal state.
	 *
	 * @param catalog the catalog snapshot the request started with, may be null if none is registered
	 * @return the final workflow state, in {@link PipelineState#SUCCEEDED} or {@link PipelineState#FAILED}
	 */
	public WorkflowState run(String question, SchemaCatalog catalog) {
		WorkflowState state = new WorkflowState(question, attemptBudget);
		SchemaCatalog context = reducer.reduce(question, catalog);
		if (context.isEmpty()) {
			state.note(ErrorKind.SCHEMA_UNAVAILABLE, "no schema catalog is available for this request");
			state.transitionTo(PipelineState.FAILED);
			logger.info("Request failed before generation: no schema");
			return state;
		}
		state.context(context);
		state.tier(router.route(question, reducer.countRelevantTables(question, context)));
		logger.info("Question routed to {} with {} of {} tables", state.tier(), context.size(), catalog.size());

		while (!state.state().isTerminal()) {
			if (Thread.currentThread().isInterrupted()) {
				state.note(ErrorKind.REQUEST_ABANDONED, "request abandoned by the caller");
				state.transitionTo(PipelineState.FAILED);
				logger.warn("Request abandoned after {} attempts", state.attempts());
				break;
			}
			PipelineState next = switch (state.state()) {
				case GENERATE -> generate(state);
				case EXECUTE_ANALYZE -> executeAndAnalyze(state);
				case FIX -> fix(state);
				case SUCCEEDED, FAILED -> throw new IllegalStateException("terminal state " + state.state());
			};
			logger.debug("{} -> {} (attempt {}/{})", state.state(), next, state.attempts(), attemptBudget);
			state.transitionTo(next);
		}
		logger.info("Request ended {} after {} attempts with confidence {}", state.state(), state.attempts(),
				state.confidence());
		return state;
	}

	private PipelineState generate(WorkflowState state) {
		state.beginAttempt(PipelineState.GENERATE.name());
		SynthesisResult result = synthesizer.synthesize(state.question(), state.context(), state.tier());
		state.candidate(result.query(), result.confidence(), result.modelId());
		ErrorKind kind = result.generationFailed() ? ErrorKind.GENERATION_FAILURE : ErrorKind.UNKNOWN_IDENTIFIER;
		result.errors().forEach(error -> state.block(kind, error));
		return PipelineState.EXECUTE_ANALYZE;
	}

	private PipelineState fix(WorkflowState state) {
		String failedQuery = state.candidateQuery();
		List<String> failures = state.outstandingMessages();
		Analysis analysis = state.analysis();
		state.beginAttempt(PipelineState.FIX.name());

		Correction correction = corrector.correct(failedQuery, state.question(), failures, analysis, state.context(),
				state.tier());
		state.candidate(correction.query(), correction.confidence(), correction.modelId());
		for (String error : correction.errors()) {
			if (error.startsWith("correction failed")) {
				boolean nothingToRun = state.candidateQuery() == null;
				if (correction.generationFailed() && nothingToRun) {
					state.block(ErrorKind.GENERATION_FAILURE, error);
				} else {
					state.note(ErrorKind.CORRECTION_FAILED, error);
				}
			} else {
				state.block(ErrorKind.UNKNOWN_IDENTIFIER, error);
			}
		}
		logger.info("Fix attempt {} via {}: {}", state.attempts(), correction.method(), correction.query());
		return PipelineState.EXECUTE_ANALYZE;
	}

	private PipelineState executeAndAnalyze(WorkflowState state) {
		String query = state.candidateQuery();
		if (query == null) {
			if (state.outstandingErrors().isEmpty()) {
				state.block(ErrorKind.GENERATION_FAILURE, "no candidate query to execute");
			}
			state.finishRound(RoundOutcome.GENERATION_FAILED);
			return retryOrFail(state);
		}

		ExecutionOutcome outcome = executor.execute(query, rowCap, executionTimeBudget);
		if (outcome instanceof ExecutionOutcome.Forbidden forbidden) {
			state.block(ErrorKind.FORBIDDEN_OPERATION, forbidden.reason());
			state.finishRound(RoundOutcome.FORBIDDEN);
			return PipelineState.FAILED;
		}
		if (outcome instanceof ExecutionOutcome.TimedOut timedOut) {
			state.block(ErrorKind.EXECUTION_TIMEOUT, timedOut.message());
			state.finishRound(RoundOutcome.EXECUTION_FAILED);
			return retryOrFail(state);
		}
		if (outcome instanceof ExecutionOutcome.EngineError engineError) {
			state.block(categorize(engineError.message()), engineError.message());
			state.finishRound(RoundOutcome.EXECUTION_FAILED);
			return retryOrFail(state);
		}

		ExecutionOutcome.Success success = (ExecutionOutcome.Success) outcome;
		Analysis analysis = analyzer.analyze(state.question(), query, success.rows(), state.candidateConfidence());
		state.executed(success.rows(), analysis, success.cacheHit());
		analysis.errors().forEach(error -> state.block(ErrorKind.SUSPECT_RESULT, error));

		if (state.confidence() >= successThreshold && state.outstandingErrors().isEmpty()) {
			state.finishRound(RoundOutcome.SUCCESS);
			return PipelineState.SUCCEEDED;
		}
		if (state.confidence() < successThreshold) {
			state.block(ErrorKind.LOW_CONFIDENCE, String.format(Locale.ROOT,
					"confidence %.2f is below the success threshold %.2f", state.confidence(), successThreshold));
		}
		state.finishRound(RoundOutcome.LOW_CONFIDENCE);
		return retryOrFail(state);
	}

	private PipelineState retryOrFail(WorkflowState state) {
		boolean recoverable = state.outstandingErrors().stream().allMatch(error -> error.kind().isRecoverable());
		if (!recoverable) {
			return PipelineState.FAILED;
		}
		if (state.hasAttemptsLeft()) {
			return PipelineState.FIX;
		}
		state.note(ErrorKind.ATTEMPTS_EXHAUSTED,
				"attempt budget of %d exhausted without reaching the success threshold".formatted(attemptBudget));
		return PipelineState.FAILED;
	}

	/**
	 * Classifies a raw engine message for the failure report. The message itself is never altered.
	 */
	static ErrorKind categorize(String engineMessage) {
		String lower = engineMessage == null ? "" : engineMessage.toLowerCase(Locale.ROOT);
		return UNKNOWN_IDENTIFIER_MARKERS.stream().anyMatch(lower::contains)
				? ErrorKind.UNKNOWN_IDENTIFIER
				: ErrorKind.EXECUTION_ERROR;
	}
}
