package org.javai.sqlpilot.synth;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.config.ConfidencePolicy;
import org.javai.sqlpilot.generation.GenerationException;
import org.javai.sqlpilot.generation.GenerationRequest;
import org.javai.sqlpilot.generation.GenerationService;
import org.javai.sqlpilot.generation.PromptTemplates;
import org.javai.sqlpilot.generation.QueryExtractor;
import org.javai.sqlpilot.generation.SchemaPromptRenderer;
import org.javai.sqlpilot.route.ComplexityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a question and its reduced context into one candidate query.
 *
 * <p>Each call makes exactly one request to the generation service; retrying is left to the caller. The
 * candidate's confidence comes from {@link IdentifierGrounding}: a query that names anything outside the reduced
 * context is forced below the success threshold and carries an "uses unknown identifier" error.</p>
 */
public final class QuerySynthesizer {

	private static final Logger logger = LoggerFactory.getLogger(QuerySynthesizer.class);

	private final GenerationService generation;
	private final SchemaPromptRenderer renderer;
	private final ConfidencePolicy policy;
	private final Duration timeBudget;
	private final QueryExtractor extractor = new QueryExtractor();
	private final IdentifierGrounding grounding = new IdentifierGrounding();

	public QuerySynthesizer(GenerationService generation, SchemaPromptRenderer renderer, ConfidencePolicy policy,
			Duration timeBudget) {
		this.generation = Objects.requireNonNull(generation, "generation must not be null");
		this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
		this.policy = Objects.requireNonNull(policy, "policy must not be null");
		this.timeBudget = Objects.requireNonNull(timeBudget, "timeBudget must not be null");
	}

	public SynthesisResult synthesize(String question, SchemaCatalog context, ComplexityTier tier) {
		String modelId = generation.modelIdFor(tier);
		String userPrompt = renderer.render(context, question) + "\n\nQUESTION:\n" + question;
		String response;
		try {
			response = generation.generate(
					new GenerationRequest(PromptTemplates.systemPrompt(tier), userPrompt, tier, timeBudget));
		} catch (GenerationException e) {
			logger.warn("Generation failed for tier {}: {}", tier, e.getMessage());
			return SynthesisResult.failure("generation failed: " + e.getMessage(), modelId);
		}

		Optional<String> candidate = extractor.extract(response);
		if (candidate.isEmpty()) {
			logger.info("No query in model response: {}", StringUtils.abbreviate(response, 200));
			return SynthesisResult.failure("response contained no extractable query", modelId);
		}

		String query = candidate.get();
		GroundingReport report = grounding.check(query, context);
		logger.info("Synthesized candidate (tier {}, grounded={}): {}", tier, report.grounded(), query);
		return new SynthesisResult(query, report.confidence(policy), report.errors(), false, modelId);
	}
}
