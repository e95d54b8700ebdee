package com.adlanda.queryagent.model;

import java.util.List;

/**
 * The router's decision together with the signals that produced it.
 *
 * @param route            The chosen fulfillment path
 * @param matchedKeywords  Weather keywords found in the query, in configuration order
 * @param indexAvailable   Whether the session had an indexed document when the query was routed
 */
public record RouteDecision(
        Route route,
        List<String> matchedKeywords,
        boolean indexAvailable
) {
    public RouteDecision {
        matchedKeywords = List.copyOf(matchedKeywords);
        if (route == Route.RAG && !indexAvailable) {
            throw new IllegalArgumentException("RAG route requires an indexed document");
        }
    }
}
