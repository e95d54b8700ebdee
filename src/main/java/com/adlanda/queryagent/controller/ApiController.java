package com.adlanda.queryagent.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    /**
     * Root endpoint with API documentation links.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Query Agent",
                "version", appVersion,
                "endpoints", Map.of(
                        "ask", "POST /api/v1/sessions/{sessionId}/ask - Answer a question (weather or indexed document)",
                        "index", "POST /api/v1/sessions/{sessionId}/document - Index a plain-text document",
                        "upload", "POST /api/v1/sessions/{sessionId}/document/upload - Index an uploaded PDF or text file",
                        "session", "GET /api/v1/sessions/{sessionId} - Index status of a session",
                        "end", "DELETE /api/v1/sessions/{sessionId} - End a session and discard its index",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
