package com.odedia.contracts.services;

/**
 * Chat-completion endpoint used by the fallback filler.
 */
public interface FallbackModelClient {

    /**
     * Sends one system and one user message to the given model.
     *
     * @return The assistant's reply text
     */
    String complete(String model, String systemPrompt, String userPrompt);
}
