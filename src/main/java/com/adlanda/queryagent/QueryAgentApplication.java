package com.adlanda.queryagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Query Agent - Main Application
 *
 * Answers natural-language questions either from a live weather lookup or from
 * a document the user indexed for their session (retrieval-augmented generation).
 *
 * This application uses:
 * - Spring Boot 3.4
 * - Spring AI for embeddings and chat completion via OpenAI-compatible APIs
 * - OpenWeatherMap for current weather
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class QueryAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryAgentApplication.class, args);
    }
}
