package org.javai.sqlpilot.generation;

import java.time.Duration;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.sqlpilot.route.ComplexityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link GenerationService} backed by Spring AI chat clients, one per complexity tier.
 *
 * <p>Tiers without their own client fall back to the default tier. Each distinct {@link ModelTier} has its own
 * concurrency ceiling; a caller that cannot get a permit within its time budget fails rather than queues. Calls
 * that outlive the budget are abandoned and their eventual response is discarded.</p>
 *
 * <pre>{@code
 * GenerationService generation = ChatClientGenerationService.builder()
 *     .defaultTier(miniClient, "gpt-4.1-mini", 8)
 *     .tier(ComplexityTier.COMPLEX, fullClient, "gpt-4.1", 2)
 *     .build();
 * }</pre>
 */
public final class ChatClientGenerationService implements GenerationService, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientGenerationService.class);

	private final ModelTier defaultTier;
	private final Map<ComplexityTier, ModelTier> tiers;
	private final Map<ModelTier, Semaphore> permits = new IdentityHashMap<>();
	private final ExecutorService workers;

	private ChatClientGenerationService(Builder builder) {
		this.defaultTier = Objects.requireNonNull(builder.defaultTier, "defaultTier must be configured");
		this.tiers = new EnumMap<>(ComplexityTier.class);
		this.tiers.putAll(builder.tiers);
		permits.put(defaultTier, new Semaphore(defaultTier.maxConcurrent(), true));
		for (ModelTier tier : tiers.values()) {
			permits.computeIfAbsent(tier, t -> new Semaphore(t.maxConcurrent(), true));
		}
		this.workers = Executors.newCachedThreadPool(daemonThreads());
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String generate(GenerationRequest request) {
		ModelTier tier = tierFor(request.tier());
		Semaphore tierPermits = permits.get(tier);
		long deadline = System.nanoTime() + request.timeBudget().toNanos();
		try {
			if (!tierPermits.tryAcquire(request.timeBudget().toNanos(), TimeUnit.NANOSECONDS)) {
				throw new GenerationException("concurrency ceiling of %d reached for tier %s"
						.formatted(tier.maxConcurrent(), request.tier()));
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GenerationException("generation abandoned while waiting for a permit", e);
		}

		Future<String> call;
		try {
			call = workers.submit(() -> {
				try {
					return invokeModel(tier, request);
				} finally {
					tierPermits.release();
				}
			});
		} catch (RejectedExecutionException e) {
			tierPermits.release();
			throw new GenerationException("generation service is shut down", e);
		}

		try {
			String content = call.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
			return content != null ? content : "";
		} catch (TimeoutException e) {
			logger.warn("Model {} gave no response within {}, abandoning the call", tier.modelId(),
					request.timeBudget());
			throw new GenerationException("no response within " + request.timeBudget(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GenerationException("generation abandoned", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			throw new GenerationException("model call failed: " + cause.getMessage(), cause);
		}
	}

	@Override
	public String modelIdFor(ComplexityTier tier) {
		return tierFor(tier).modelId();
	}

	@Override
	public void close() {
		workers.shutdownNow();
	}

	private ModelTier tierFor(ComplexityTier tier) {
		return tiers.getOrDefault(tier, defaultTier);
	}

	private String invokeModel(ModelTier tier, GenerationRequest request) {
		ChatClient.ChatClientRequestSpec prompt = tier.chatClient().prompt();
		if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
			prompt.system(request.systemPrompt());
		}
		prompt.user(request.userPrompt());
		logger.debug("System message:\n{}", request.systemPrompt());
		logger.debug("User message:\n{}", request.userPrompt());
		String content = prompt.call().content();
		logger.debug("Response from {}:\n{}", tier.modelId(), content);
		return content;
	}

	private static ThreadFactory daemonThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "sqlpilot-gen-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	public static final class Builder {

		private ModelTier defaultTier;
		private final Map<ComplexityTier, ModelTier> tiers = new EnumMap<>(ComplexityTier.class);

		private Builder() {
		}

		public Builder defaultTier(ChatClient chatClient, String modelId, int maxConcurrent) {
			this.defaultTier = new ModelTier(chatClient, modelId, maxConcurrent);
			return this;
		}

		public Builder defaultTier(ModelTier tier) {
			this.defaultTier = tier;
			return this;
		}

		public Builder tier(ComplexityTier complexity, ChatClient chatClient, String modelId, int maxConcurrent) {
			return tier(complexity, new ModelTier(chatClient, modelId, maxConcurrent));
		}

		public Builder tier(ComplexityTier complexity, ModelTier tier) {
			tiers.put(Objects.requireNonNull(complexity, "complexity must not be null"),
					Objects.requireNonNull(tier, "tier must not be null"));
			return this;
		}

		public ChatClientGenerationService build() {
			return new ChatClientGenerationService(this);
		}
	}
}
