package org.javai.sqlpilot.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.javai.sqlpilot.analyze.Analysis;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.exec.QueryRows;
import org.javai.sqlpilot.metrics.RoundOutcome;
import org.javai.sqlpilot.metrics.RoundRecord;
import org.javai.sqlpilot.route.ComplexityTier;

/**
 * The unit of work for one question. Owned by the thread processing the request and mutated only by the
 * {@link Supervisor}, one stage at a time.
 *
 * <p>Errors are kept twice: {@link #outstandingErrors()} holds what blocks success in the current round and is
 * cleared whenever a new candidate is produced; {@link #errors()} is the full history reported on failure.</p>
 */
public final class WorkflowState {

	private final String question;
	private final int attemptBudget;
	private final long startNanos = System.nanoTime();

	private SchemaCatalog context = SchemaCatalog.empty();
	private ComplexityTier tier;
	private PipelineState state = PipelineState.GENERATE;
	private String candidateQuery;
	private double candidateConfidence;
	private String modelId;
	private QueryRows results;
	private Analysis analysis = Analysis.none();
	private double confidence;
	private boolean executed;
	private boolean cacheHit;
	private int attempts;

	private final List<PipelineError> outstanding = new ArrayList<>();
	private final List<PipelineError> errors = new ArrayList<>();
	private final List<RoundRecord> rounds = new ArrayList<>();
	private String roundStage;
	private long roundStartNanos;

	public WorkflowState(String question, int attemptBudget) {
		this.question = Objects.requireNonNull(question, "question must not be null");
		if (attemptBudget < 1) {
			throw new IllegalArgumentException("attemptBudget must be >= 1");
		}
		this.attemptBudget = attemptBudget;
	}

	public String question() {
		return question;
	}

	public SchemaCatalog context() {
		return context;
	}

	void context(SchemaCatalog context) {
		this.context = context;
	}

	public ComplexityTier tier() {
		return tier;
	}

	void tier(ComplexityTier tier) {
		this.tier = tier;
	}

	public PipelineState state() {
		return state;
	}

	void transitionTo(PipelineState next) {
		this.state = next;
	}

	/**
	 * Starts a generate or fix round.
	 *
	 * @throws IllegalStateException if the attempt budget is already spent
	 */
	void beginAttempt(String stage) {
		if (attempts >= attemptBudget) {
			throw new IllegalStateException("attempt budget of %d exhausted".formatted(attemptBudget));
		}
		attempts++;
		roundStage = stage;
		roundStartNanos = System.nanoTime();
	}

	void finishRound(RoundOutcome outcome) {
		long millis = (System.nanoTime() - roundStartNanos) / 1_000_000;
		String detail = outstanding.isEmpty() ? null : outstanding.get(0).message();
		rounds.add(new RoundRecord(attempts, roundStage, tier, modelId, outcome, Math.max(0, millis), detail));
	}

	public int attempts() {
		return attempts;
	}

	public int attemptBudget() {
		return attemptBudget;
	}

	public boolean hasAttemptsLeft() {
		return attempts < attemptBudget;
	}

	/**
	 * Installs a new candidate. Results, confidence and outstanding errors of the previous round are discarded.
	 */
	void candidate(String query, double confidence, String modelId) {
		this.candidateQuery = query == null || query.isBlank() ? null : query;
		this.candidateConfidence = confidence;
		this.modelId = modelId;
		this.results = null;
		this.analysis = Analysis.none();
		this.confidence = 0.0;
		this.executed = false;
		this.outstanding.clear();
	}

	public String candidateQuery() {
		return candidateQuery;
	}

	public double candidateConfidence() {
		return candidateConfidence;
	}

	public String modelId() {
		return modelId;
	}

	void executed(QueryRows rows, Analysis analysis, boolean cacheHit) {
		this.results = rows;
		this.analysis = analysis;
		this.confidence = analysis.confidence();
		this.executed = true;
		this.cacheHit |= cacheHit;
	}

	public QueryRows results() {
		return results;
	}

	public Analysis analysis() {
		return analysis;
	}

	/**
	 * Confidence of the last executed candidate; 0 until a candidate has executed.
	 */
	public double confidence() {
		return executed ? confidence : 0.0;
	}

	public boolean cacheHit() {
		return cacheHit;
	}

	/**
	 * Records an error that blocks success in the current round.
	 */
	void block(ErrorKind kind, String message) {
		PipelineError error = new PipelineError(kind, message, attempts);
		outstanding.add(error);
		errors.add(error);
	}

	/**
	 * Records an error for the failure report only.
	 */
	void note(ErrorKind kind, String message) {
		errors.add(new PipelineError(kind, message, attempts));
	}

	public List<PipelineError> outstandingErrors() {
		return Collections.unmodifiableList(outstanding);
	}

	public List<PipelineError> errors() {
		return Collections.unmodifiableList(errors);
	}

	public List<String> outstandingMessages() {
		return outstanding.stream().map(PipelineError::message).toList();
	}

	public List<RoundRecord> rounds() {
		return Collections.unmodifiableList(rounds);
	}

	public long elapsedMillis() {
		return (System.nanoTime() - startNanos) / 1_000_000;
	}
}
