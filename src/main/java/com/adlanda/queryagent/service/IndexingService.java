package com.adlanda.queryagent.service;

import com.adlanda.queryagent.config.AgentProperties;
import com.adlanda.queryagent.exception.EmbeddingDimensionMismatchException;
import com.adlanda.queryagent.exception.EmptyDocumentException;
import com.adlanda.queryagent.model.Chunk;
import com.adlanda.queryagent.model.EmbeddingVector;
import com.adlanda.queryagent.model.IndexHandle;
import com.adlanda.queryagent.repository.SessionIndexRegistry;
import com.adlanda.queryagent.repository.VectorIndex;
import com.adlanda.queryagent.repository.VectorPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Service responsible for chunking a session's document and publishing its index.
 *
 * Indexing and discarding are serialized per session. Different sessions
 * index in parallel. A session's lock lives only while the session has an index.
 */
@Service
public class IndexingService {

    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private static final List<String> SEPARATORS = List.of("\n\n", "\n");

    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final SessionIndexRegistry registry;
    private final int chunkSize;
    private final int chunkOverlap;

    private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();

    public IndexingService(EmbeddingService embeddingService,
                           VectorIndex vectorIndex,
                           SessionIndexRegistry registry,
                           AgentProperties properties) {
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
        this.registry = registry;
        this.chunkSize = properties.getRag().getChunkSize();
        this.chunkOverlap = properties.getRag().getChunkOverlap();

        if (chunkSize < 1) {
            throw new IllegalArgumentException("agent.rag.chunk-size must be positive, was " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "agent.rag.chunk-overlap must be in [0, chunk-size), was " + chunkOverlap);
        }
    }

    /**
     * Chunks, embeds and indexes a document, replacing the session's previous index.
     *
     * @param sessionId    Session that owns the document
     * @param documentText Full document text
     * @return Handle of the newly published index
     * @throws EmptyDocumentException if the text is null or blank
     */
    public IndexHandle index(String sessionId, String documentText) {
        if (documentText == null || documentText.isBlank()) {
            throw new EmptyDocumentException(sessionId);
        }

        ReentrantLock lock = acquire(sessionId);
        try {
            long generation = registry.find(sessionId).map(h -> h.generation() + 1).orElse(1L);

            List<Chunk> chunks = chunkContent(documentText, sessionId);
            List<EmbeddingVector> vectors = embeddingService.embedChunks(chunks);

            int dimension = vectors.get(0).dimension();
            List<VectorPoint> points = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                EmbeddingVector vector = vectors.get(i);
                if (vector.dimension() != dimension) {
                    throw new EmbeddingDimensionMismatchException(dimension, vector.dimension());
                }
                points.add(VectorPoint.of(chunks.get(i), vector));
            }

            // One collection per session; upsert swaps it wholesale
            vectorIndex.upsert(sessionId, points);
            IndexHandle handle = new IndexHandle(sessionId, sessionId, generation, chunks, dimension, Instant.now());
            registry.publish(handle);

            log.info("Indexed session {} (generation {}): {} chunks, dimension {}",
                    sessionId, generation, chunks.size(), dimension);
            return handle;
        } finally {
            if (!registry.isIndexed(sessionId)) {
                sessionLocks.remove(sessionId, lock);
            }
            lock.unlock();
        }
    }

    /**
     * Discards the session's index when the session ends.
     *
     * @return the discarded handle, if the session was indexed
     */
    public Optional<IndexHandle> discard(String sessionId) {
        while (true) {
            ReentrantLock lock = sessionLocks.get(sessionId);
            if (lock == null) {
                return Optional.empty();
            }
            lock.lock();
            try {
                if (sessionLocks.get(sessionId) != lock) {
                    continue;
                }
                Optional<IndexHandle> removed = registry.remove(sessionId);
                removed.ifPresent(handle -> {
                    vectorIndex.delete(handle.collectionId());
                    log.info("Discarded index of session {} ({} chunks)", sessionId, handle.chunkCount());
                });
                sessionLocks.remove(sessionId, lock);
                return removed;
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Splits content into overlapping fixed-size windows, preserving order.
     *
     * A window ends at the last paragraph break, line break or whitespace (in that
     * order of preference) found in its second half; otherwise it is cut at exactly
     * {@code chunkSize} characters.
     * The next window starts {@code chunkOverlap} characters before the previous end.
     * Windows consisting only of whitespace are dropped.
     */
    List<Chunk> chunkContent(String content, String sessionId) {
        List<Chunk> chunks = new ArrayList<>();
        int length = content.length();
        int start = 0;
        int position = 0;

        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length) {
                int breakAt = breakPoint(content, start + chunkSize / 2, end);
                if (breakAt > start) {
                    end = breakAt;
                }
            }

            String text = content.substring(start, end).strip();
            if (!text.isEmpty()) {
                chunks.add(new Chunk(chunkId(sessionId, position, text), text, position));
                position++;
            }

            if (end >= length) {
                break;
            }
            start = Math.max(end - chunkOverlap, start + 1);
        }

        return chunks;
    }

    private int breakPoint(String content, int from, int to) {
        for (String separator : SEPARATORS) {
            int idx = content.lastIndexOf(separator, to - separator.length());
            if (idx >= from) {
                return idx + separator.length();
            }
        }
        for (int i = to; i > from; i--) {
            if (Character.isWhitespace(content.charAt(i - 1))) {
                return i;
            }
        }
        return -1;
    }

    private String chunkId(String sessionId, int position, String text) {
        String key = sessionId + ":" + position + ":" + text;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Locks the session, retrying if the lock was retired by a discard while this
     * thread waited on it. Only the lock currently mapped to the session is ever held.
     */
    private ReentrantLock acquire(String sessionId) {
        while (true) {
            ReentrantLock lock = sessionLocks.computeIfAbsent(sessionId, id -> new ReentrantLock());
            lock.lock();
            if (sessionLocks.get(sessionId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    int trackedSessions() {
        return sessionLocks.size();
    }
}
