package org.javai.sqlpilot.generation;

import org.springframework.ai.chat.client.ChatClient;

/**
 * A chat client serving one complexity tier, with its concurrency ceiling.
 *
 * @param chatClient the Spring AI ChatClient
 * @param modelId optional identifier for observability (e.g., "gpt-4.1-mini")
 * @param maxConcurrent maximum calls in flight to this client (≥1)
 */
public record ModelTier(
		ChatClient chatClient,
		String modelId,
		int maxConcurrent
) {
	/**
	 * Canonical constructor with validation.
	 */
	public ModelTier {
		if (chatClient == null) {
			throw new IllegalArgumentException("chatClient must not be null");
		}
		if (maxConcurrent < 1) {
			throw new IllegalArgumentException("maxConcurrent must be >= 1");
		}
	}

	/**
	 * Convenience constructor allowing a single call at a time.
	 *
	 * @param chatClient the Spring AI ChatClient
	 * @param modelId optional identifier for observability
	 */
	public ModelTier(ChatClient chatClient, String modelId) {
		this(chatClient, modelId, 1);
	}
}
