package com.adlanda.queryagent;

import com.adlanda.queryagent.config.AgentProperties;
import com.adlanda.queryagent.model.IndexHandle;
import com.adlanda.queryagent.service.DocumentTextExtractor;
import com.adlanda.queryagent.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Optionally indexes a document from disk into a fixed session on startup.
 *
 * Enabled with agent.preload.enabled=true and agent.preload.path.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class DocumentPreloadRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DocumentPreloadRunner.class);

    private final AgentProperties properties;
    private final DocumentTextExtractor textExtractor;
    private final IndexingService indexingService;

    public DocumentPreloadRunner(AgentProperties properties,
                                 DocumentTextExtractor textExtractor,
                                 IndexingService indexingService) {
        this.properties = properties;
        this.textExtractor = textExtractor;
        this.indexingService = indexingService;
    }

    @Override
    public void run(ApplicationArguments args) {
        AgentProperties.Preload preload = properties.getPreload();
        if (!preload.isEnabled()) {
            return;
        }
        if (preload.getPath() == null || preload.getPath().isBlank()) {
            log.warn("Document preload is enabled but agent.preload.path is not set");
            return;
        }

        Path path = Path.of(preload.getPath());
        if (!Files.isRegularFile(path)) {
            log.warn("Preload document does not exist: {}", path);
            return;
        }

        log.info("Preloading {} into session {}...", path.getFileName(), preload.getSessionId());
        try {
            byte[] content = Files.readAllBytes(path);
            String text = textExtractor.extractText(path.getFileName().toString(), null, content);
            IndexHandle handle = indexingService.index(preload.getSessionId(), text);
            log.info("Preload complete: {} chunks indexed for session {}", handle.chunkCount(), handle.sessionId());
        } catch (IOException e) {
            log.error("Failed to read preload document {}", path, e);
        } catch (RuntimeException e) {
            // Startup continues without a preloaded index
            log.error("Failed to preload document {}: {}", path, e.getMessage(), e);
        }
    }
}
