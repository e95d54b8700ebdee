package com.adlanda.queryagent.model;

import com.adlanda.queryagent.exception.ErrorKind;

/**
 * Mutable state threaded through one query-answer cycle.
 *
 * Created fresh for every query and owned by the executor running the cycle.
 * Not thread-safe.
 */
public class AgentState {

    private final String sessionId;
    private final String query;

    private AgentStage stage = AgentStage.START;
    private RouteDecision routeDecision;
    private RetrievedContext retrievedContext;
    private WeatherPayload weather;
    private String answer;
    private AgentError error;

    public AgentState(String sessionId, String query) {
        if (query == null) {
            throw new IllegalArgumentException("Query must not be null");
        }
        this.sessionId = sessionId;
        this.query = query;
    }

    public void routed(RouteDecision decision) {
        requireStage(AgentStage.START);
        this.routeDecision = decision;
        this.stage = AgentStage.ROUTED;
    }

    public void fulfilledByRetrieval(RetrievedContext context) {
        requireStage(AgentStage.ROUTED);
        this.retrievedContext = context;
        this.stage = AgentStage.FULFILLED;
    }

    public void fulfilledByWeather(WeatherPayload payload) {
        requireStage(AgentStage.ROUTED);
        this.weather = payload;
        this.stage = AgentStage.FULFILLED;
    }

    public void answered(String answer) {
        requireStage(AgentStage.FULFILLED);
        this.answer = answer;
        this.stage = AgentStage.ANSWERED;
    }

    /**
     * Moves the cycle to ERROR from any non-terminal stage. Any answer is cleared.
     */
    public void failed(ErrorKind kind, String message) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Cycle already ended in " + stage);
        }
        this.error = new AgentError(kind, message);
        this.answer = null;
        this.stage = AgentStage.ERROR;
    }

    /**
     * Returns the payload gathered in the FULFILLED stage, or null before that.
     */
    public FulfillmentPayload fulfillment() {
        return weather != null ? weather : retrievedContext;
    }

    private void requireStage(AgentStage expected) {
        if (stage != expected) {
            throw new IllegalStateException("Expected stage " + expected + " but cycle is in " + stage);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getQuery() {
        return query;
    }

    public AgentStage getStage() {
        return stage;
    }

    public RouteDecision getRouteDecision() {
        return routeDecision;
    }

    public RetrievedContext getRetrievedContext() {
        return retrievedContext;
    }

    public WeatherPayload getWeather() {
        return weather;
    }

    public String getAnswer() {
        return answer;
    }

    public AgentError getError() {
        return error;
    }
}
