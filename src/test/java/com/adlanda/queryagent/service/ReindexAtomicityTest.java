package com.adlanda.queryagent.service;

import com.adlanda.queryagent.TestEmbeddings;
import com.adlanda.queryagent.config.AgentProperties;
import com.adlanda.queryagent.model.IndexHandle;
import com.adlanda.queryagent.model.ScoredChunk;
import com.adlanda.queryagent.repository.InMemoryVectorIndex;
import com.adlanda.queryagent.repository.SessionIndexRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Retrievals racing with re-indexing of the same session must see one whole
 * document, never chunks from both.
 */
class ReindexAtomicityTest {

    private static final String SESSION = "shared";
    private static final int READERS = 4;
    private static final int REINDEX_ROUNDS = 200;

    @Test
    void retrieveDuringReindex_observesExactlyOldOrNewChunkSet() throws Exception {
        EmbeddingService embeddings = TestEmbeddings.bagOfWords(64);
        InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex();
        SessionIndexRegistry registry = new SessionIndexRegistry();
        AgentProperties properties = new AgentProperties();
        properties.getRag().setChunkSize(40);
        properties.getRag().setChunkOverlap(0);
        IndexingService indexingService = new IndexingService(embeddings, vectorIndex, registry, properties);
        RetrievalService retrievalService = new RetrievalService(embeddings, vectorIndex);

        String documentA = document("alpha", 6);
        String documentB = document("bravo", 3);
        Set<String> chunksA = contents(indexingService.chunkContent(documentA, SESSION).stream()
                .map(c -> new ScoredChunk(c, 0)).toList());
        Set<String> chunksB = contents(indexingService.chunkContent(documentB, SESSION).stream()
                .map(c -> new ScoredChunk(c, 0)).toList());
        assertThat(chunksA).doesNotContainAnyElementsOf(chunksB);

        indexingService.index(SESSION, documentA);

        ExecutorService pool = Executors.newFixedThreadPool(READERS + 1);
        AtomicBoolean writing = new AtomicBoolean(true);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<Set<String>> mixed = new ConcurrentLinkedQueue<>();
        AtomicInteger observations = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        futures.add(pool.submit(() -> {
            start.await();
            for (int i = 0; i < REINDEX_ROUNDS; i++) {
                indexingService.index(SESSION, i % 2 == 0 ? documentB : documentA);
            }
            writing.set(false);
            return null;
        }));
        for (int r = 0; r < READERS; r++) {
            futures.add(pool.submit(() -> {
                start.await();
                do {
                    IndexHandle handle = registry.find(SESSION).orElseThrow();
                    Set<String> seen = contents(retrievalService.retrieve("alpha bravo", handle, 100).chunks());
                    if (!seen.equals(chunksA) && !seen.equals(chunksB)) {
                        mixed.add(seen);
                    }
                    observations.incrementAndGet();
                } while (writing.get());
                return null;
            }));
        }

        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(60, TimeUnit.SECONDS)).isTrue();
        for (Future<?> future : futures) {
            future.get();
        }

        assertThat(observations.get()).isPositive();
        assertThat(mixed).isEmpty();
    }

    private static String document(String word, int sentences) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < sentences; i++) {
            sb.append(word).append(" sentence number ").append(i).append(". ");
        }
        return sb.toString();
    }

    private static Set<String> contents(List<ScoredChunk> chunks) {
        return chunks.stream().map(sc -> sc.chunk().content()).collect(Collectors.toSet());
    }
}
