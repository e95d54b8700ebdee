package com.adlanda.queryagent.health;

import com.adlanda.queryagent.repository.SessionIndexRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the session indexes.
 *
 * Reports:
 * - Number of sessions with a published index
 * - Total chunks across those indexes
 * - Timestamp of the most recent indexing
 */
@Component
public class IndexHealthIndicator implements HealthIndicator {

    private final SessionIndexRegistry registry;

    public IndexHealthIndicator(SessionIndexRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("sessionsIndexed", registry.all().size())
                .withDetail("chunksIndexed", registry.totalChunks())
                .withDetail("lastIndexedAt", registry.lastIndexedAt().map(Object::toString).orElse("never"))
                .build();
    }
}
