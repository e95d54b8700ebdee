package com.adlanda.queryagent.model;

/**
 * Fulfillment path chosen for a query.
 */
public enum Route {
    WEATHER,
    RAG,
    UNSUPPORTED
}
