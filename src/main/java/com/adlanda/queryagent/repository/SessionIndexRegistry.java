package com.adlanda.queryagent.repository;

import com.adlanda.queryagent.model.IndexHandle;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps sessions to their currently published index handle.
 */
@Repository
public class SessionIndexRegistry {

    private final Map<String, IndexHandle> handles = new ConcurrentHashMap<>();

    public Optional<IndexHandle> find(String sessionId) {
        return Optional.ofNullable(handles.get(sessionId));
    }

    public boolean isIndexed(String sessionId) {
        return handles.containsKey(sessionId);
    }

    /**
     * Publishes a handle, replacing any previous handle of the same session.
     *
     * @return the replaced handle, if any
     */
    public Optional<IndexHandle> publish(IndexHandle handle) {
        return Optional.ofNullable(handles.put(handle.sessionId(), handle));
    }

    public Optional<IndexHandle> remove(String sessionId) {
        return Optional.ofNullable(handles.remove(sessionId));
    }

    public Collection<IndexHandle> all() {
        return List.copyOf(handles.values());
    }

    public int totalChunks() {
        return handles.values().stream().mapToInt(IndexHandle::chunkCount).sum();
    }

    public Optional<Instant> lastIndexedAt() {
        return handles.values().stream()
                .map(IndexHandle::indexedAt)
                .max(Instant::compareTo);
    }
}
