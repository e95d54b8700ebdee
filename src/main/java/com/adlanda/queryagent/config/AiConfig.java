package com.adlanda.queryagent.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chat client used for answer synthesis.
 *
 * The EmbeddingModel and ChatModel themselves come from Spring AI's OpenAI
 * auto-configuration; the chat model can point at any OpenAI-compatible
 * endpoint through spring.ai.openai.chat.base-url.
 */
@Configuration
public class AiConfig {

    @Bean
    public ChatClient answerChatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }
}
