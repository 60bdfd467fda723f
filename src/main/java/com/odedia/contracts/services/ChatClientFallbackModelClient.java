package com.odedia.contracts.services;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;

/**
 * {@link FallbackModelClient} backed by a Spring AI {@link ChatClient} on the
 * OpenAI-compatible chat completions API (Perplexity by default, see
 * {@code spring.ai.openai.base-url}).
 */
@Component
public class ChatClientFallbackModelClient implements FallbackModelClient {

    private final ChatClient chatClient;

    public ChatClientFallbackModelClient(ChatClient.Builder chatClientBuilder) {
        this.chatClient = chatClientBuilder.build();
    }

    @Override
    public String complete(String model, String systemPrompt, String userPrompt) {
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .temperature(0.0)
                .build();
        return chatClient.prompt()
                .options(options)
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
    }
}
