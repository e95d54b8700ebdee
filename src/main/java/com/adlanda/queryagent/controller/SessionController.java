package com.adlanda.queryagent.controller;

import com.adlanda.queryagent.agent.AgentExecutor;
import com.adlanda.queryagent.exception.ErrorKind;
import com.adlanda.queryagent.model.AgentResponse;
import com.adlanda.queryagent.model.AskRequest;
import com.adlanda.queryagent.model.IndexHandle;
import com.adlanda.queryagent.model.IndexRequest;
import com.adlanda.queryagent.model.IndexResponse;
import com.adlanda.queryagent.repository.SessionIndexRegistry;
import com.adlanda.queryagent.service.DocumentTextExtractor;
import com.adlanda.queryagent.service.IndexingService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for per-session document indexing and question answering.
 */
@RestController
@RequestMapping("/api/v1/sessions/{sessionId}")
public class SessionController {

    private final AgentExecutor agentExecutor;
    private final IndexingService indexingService;
    private final DocumentTextExtractor textExtractor;
    private final SessionIndexRegistry registry;

    public SessionController(AgentExecutor agentExecutor,
                             IndexingService indexingService,
                             DocumentTextExtractor textExtractor,
                             SessionIndexRegistry registry) {
        this.agentExecutor = agentExecutor;
        this.indexingService = indexingService;
        this.textExtractor = textExtractor;
        this.registry = registry;
    }

    /**
     * Answers a question. Failed cycles still return the full response body, with a status matching the error kind.
     */
    @PostMapping("/ask")
    public ResponseEntity<AgentResponse> ask(@PathVariable String sessionId,
                                             @Valid @RequestBody AskRequest request) {
        AgentResponse response = request.topK() != null
                ? agentExecutor.answer(request.question(), sessionId, request.topK())
                : agentExecutor.answer(request.question(), sessionId);

        HttpStatus status = response.succeeded() ? HttpStatus.OK : statusFor(response.error().kind());
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Indexes a plain-text document, replacing any document the session had.
     */
    @PostMapping("/document")
    public ResponseEntity<IndexResponse> indexText(@PathVariable String sessionId,
                                                   @Valid @RequestBody IndexRequest request) {
        IndexHandle handle = indexingService.index(sessionId, request.text());
        return ResponseEntity.status(HttpStatus.CREATED).body(IndexResponse.from(handle));
    }

    /**
     * Indexes an uploaded PDF or text file, replacing any document the session had.
     */
    @PostMapping(path = "/document/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IndexResponse> indexUpload(@PathVariable String sessionId,
                                                     @RequestParam("file") MultipartFile file) throws IOException {
        String text = textExtractor.extractText(file.getOriginalFilename(), file.getContentType(), file.getBytes());
        IndexHandle handle = indexingService.index(sessionId, text);
        return ResponseEntity.status(HttpStatus.CREATED).body(IndexResponse.from(handle));
    }

    /**
     * Get index status of the session.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getSession(@PathVariable String sessionId) {
        Optional<IndexHandle> handle = registry.find(sessionId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("status", handle.isPresent() ? "indexed" : "empty");
        body.put("totalChunks", handle.map(IndexHandle::chunkCount).orElse(0));
        handle.ifPresent(h -> {
            body.put("generation", h.generation());
            body.put("indexedAt", h.indexedAt().toString());
        });
        return ResponseEntity.ok(body);
    }

    /**
     * Ends the session and discards its index.
     */
    @DeleteMapping
    public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        return indexingService.discard(sessionId).isPresent()
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NO_INDEX, UNROUTABLE_QUERY -> HttpStatus.CONFLICT;
            case LOCATION_NOT_FOUND, EMBEDDING_DIMENSION_MISMATCH -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EMPTY_DOCUMENT -> HttpStatus.BAD_REQUEST;
            case UNSUPPORTED_DOCUMENT -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case UPSTREAM_CAPABILITY -> HttpStatus.BAD_GATEWAY;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
