package com.adlanda.queryagent.service;

import com.adlanda.queryagent.exception.UpstreamCapabilityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

/**
 * Thin wrapper around the chat model: prompt in, text out.
 */
@Service
public class CompletionService {

    private static final Logger log = LoggerFactory.getLogger(CompletionService.class);

    private final ChatClient chatClient;

    public CompletionService(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    /**
     * Sends a system instruction and a user message to the chat model.
     *
     * @return The model's reply
     * @throws UpstreamCapabilityException if the call fails or the reply is blank
     */
    public String complete(String systemPrompt, String userPrompt) {
        String content;
        try {
            content = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new UpstreamCapabilityException("completion", e);
        }

        if (content == null || content.isBlank()) {
            throw new UpstreamCapabilityException("completion", "model returned an empty reply");
        }
        log.debug("Completion returned {} characters", content.length());
        return content.strip();
    }
}
