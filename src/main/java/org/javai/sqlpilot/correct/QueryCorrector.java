package org.javai.sqlpilot.correct;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.javai.sqlpilot.analyze.Analysis;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.config.ConfidencePolicy;
import org.javai.sqlpilot.generation.GenerationException;
import org.javai.sqlpilot.generation.GenerationRequest;
import org.javai.sqlpilot.generation.GenerationService;
import org.javai.sqlpilot.generation.PromptTemplates;
import org.javai.sqlpilot.generation.QueryExtractor;
import org.javai.sqlpilot.generation.SchemaPromptRenderer;
import org.javai.sqlpilot.route.ComplexityTier;
import org.javai.sqlpilot.sql.SqlText;
import org.javai.sqlpilot.synth.GroundingReport;
import org.javai.sqlpilot.synth.IdentifierGrounding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs a failing query.
 *
 * <p>Deterministic patterns are tried first, in order, against the round's error text. The first one that yields
 * a textually different query wins and the result carries the policy's fixed correction confidence. If no pattern
 * applies, the generation service is asked once for a repaired query, given the failed query and the exact error
 * text. If that fails too, the original query comes back unchanged with {@link Correction.Method#NONE}.</p>
 *
 * <p>Every returned query is grounded against the reduced context, so a repair that introduces unknown names is
 * scored below the success threshold.</p>
 */
public final class QueryCorrector {

	private static final Logger logger = LoggerFactory.getLogger(QueryCorrector.class);

	private final GenerationService generation;
	private final SchemaPromptRenderer renderer;
	private final ConfidencePolicy policy;
	private final Duration timeBudget;
	private final List<CorrectionPattern> patterns;
	private final QueryExtractor extractor = new QueryExtractor();
	private final IdentifierGrounding grounding = new IdentifierGrounding();

	public QueryCorrector(GenerationService generation, SchemaPromptRenderer renderer, ConfidencePolicy policy,
			Duration timeBudget) {
		this(generation, renderer, policy, timeBudget, defaultPatterns());
	}

	public QueryCorrector(GenerationService generation, SchemaPromptRenderer renderer, ConfidencePolicy policy,
			Duration timeBudget, List<CorrectionPattern> patterns) {
		this.generation = Objects.requireNonNull(generation, "generation must not be null");
		this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
		this.policy = Objects.requireNonNull(policy, "policy must not be null");
		this.timeBudget = Objects.requireNonNull(timeBudget, "timeBudget must not be null");
		this.patterns = List.copyOf(patterns);
	}

	public static List<CorrectionPattern> defaultPatterns() {
		return List.of(new IdentifierNormalization(), new TableQualification());
	}

	/**
	 * @param originalQuery the failing query, may be empty when generation never produced one
	 * @param errors error messages of the failed round
	 * @param analysis analysis of the failed round's result, {@link Analysis#none()} if nothing executed
	 */
	public Correction correct(String originalQuery, String question, List<String> errors, Analysis analysis,
			SchemaCatalog context, ComplexityTier tier) {
		String original = originalQuery != null ? originalQuery : "";
		String errorText = String.join("\n", errors);

		if (!original.isBlank()) {
			Optional<Correction> patterned = applyPatterns(original, errorText, context);
			if (patterned.isPresent()) {
				return patterned.get();
			}
		}
		return repairWithModel(original, question, errorText, analysis, context, tier);
	}

	private Optional<Correction> applyPatterns(String original, String errorText, SchemaCatalog context) {
		String lowerCaseErrors = errorText.toLowerCase(Locale.ROOT);
		for (CorrectionPattern pattern : patterns) {
			if (!pattern.matches(lowerCaseErrors)) {
				continue;
			}
			Optional<String> repaired = pattern.apply(original, errorText, context);
			if (repaired.isPresent() && differs(repaired.get(), original)) {
				GroundingReport report = grounding.check(repaired.get(), context);
				double confidence = report.grounded() ? policy.correctionConfidence() : policy.ungroundedCap();
				logger.info("Pattern {} repaired query: {}", pattern.name(), repaired.get());
				return Optional.of(new Correction(repaired.get(), confidence, Correction.Method.PATTERN,
						report.errors(), false, null));
			}
		}
		return Optional.empty();
	}

	private Correction repairWithModel(String original, String question, String errorText, Analysis analysis,
			SchemaCatalog context, ComplexityTier tier) {
		String modelId = generation.modelIdFor(tier);
		String request = original.isBlank()
				? PromptTemplates.REGENERATE_TEMPLATE.formatted(question, errorText)
				: PromptTemplates.REPAIR_TEMPLATE.formatted(question, original, errorText, suggestions(analysis));
		String userPrompt = renderer.render(context, question) + "\n\n" + request;

		String response;
		try {
			response = generation.generate(
					new GenerationRequest(PromptTemplates.systemPrompt(tier), userPrompt, tier, timeBudget));
		} catch (GenerationException e) {
			logger.warn("Repair generation failed: {}", e.getMessage());
			return unchanged(original, context, "generation failed: " + e.getMessage(), true, modelId);
		}

		Optional<String> candidate = extractor.extract(response);
		if (candidate.isEmpty()) {
			return unchanged(original, context, "repair response contained no extractable query", true, modelId);
		}
		if (!differs(candidate.get(), original)) {
			return unchanged(original, context, "repair produced the same query", false, modelId);
		}
		GroundingReport report = grounding.check(candidate.get(), context);
		logger.info("Model repaired query: {}", candidate.get());
		return new Correction(candidate.get(), report.confidence(policy), Correction.Method.MODEL, report.errors(),
				false, modelId);
	}

	private Correction unchanged(String original, SchemaCatalog context, String reason, boolean generationFailed,
			String modelId) {
		List<String> errors = new ArrayList<>();
		errors.add("correction failed: " + reason);
		double confidence = 0.0;
		if (!original.isBlank()) {
			GroundingReport report = grounding.check(original, context);
			errors.addAll(report.errors());
			confidence = report.confidence(policy);
		}
		logger.info("No correction available: {}", reason);
		return new Correction(original, confidence, Correction.Method.NONE, errors, generationFailed, modelId);
	}

	private static String suggestions(Analysis analysis) {
		if (analysis == null || analysis.suggestions().isEmpty()) {
			return "";
		}
		return "SUGGESTIONS:\n- " + String.join("\n- ", analysis.suggestions()) + "\n";
	}

	private static boolean differs(String candidate, String original) {
		return !SqlText.normalize(candidate).equals(SqlText.normalize(original));
	}
}
