package com.adlanda.queryagent.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Chunks retrieved for a query, ordered by descending score.
 */
public record RetrievedContext(List<ScoredChunk> chunks) implements FulfillmentPayload {

    public RetrievedContext {
        chunks = List.copyOf(chunks);
    }

    public static RetrievedContext empty() {
        return new RetrievedContext(List.of());
    }

    public int size() {
        return chunks.size();
    }

    @Override
    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    @Override
    public String render() {
        return chunks.stream()
                .map(sc -> sc.chunk().content())
                .collect(Collectors.joining("\n\n"));
    }
}
