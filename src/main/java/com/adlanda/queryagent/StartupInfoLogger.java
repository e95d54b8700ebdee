package com.adlanda.queryagent;

import com.adlanda.queryagent.config.AgentProperties;
import com.adlanda.queryagent.repository.SessionIndexRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after DocumentPreloadRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final SessionIndexRegistry registry;
    private final AgentProperties properties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(SessionIndexRegistry registry, AgentProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Query Agent v{}
            Indexed sessions: {} ({} chunks)
            Weather keywords: {}

            API Endpoints:
              GET    http://localhost:{}/api/v1
              POST   http://localhost:{}/api/v1/sessions/{sessionId}/ask
              POST   http://localhost:{}/api/v1/sessions/{sessionId}/document
              DELETE http://localhost:{}/api/v1/sessions/{sessionId}

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, registry.all().size(), registry.totalChunks(),
            properties.getRouter().getWeatherKeywords(),
            port, port, port, port, port
        );
    }
}
