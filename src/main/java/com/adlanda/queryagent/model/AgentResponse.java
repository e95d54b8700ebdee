package com.adlanda.queryagent.model;

import java.util.List;

/**
 * Outcome of one query cycle.
 *
 * @param sessionId        Session the query was answered for
 * @param route            Chosen route, or null if the cycle failed before routing
 * @param matchedSignals   Weather keywords that matched the query
 * @param answer           Final answer; null whenever {@code error} is set
 * @param contextUsed      Chunks the answer was grounded on (RAG route only)
 * @param weather          Weather data the answer was grounded on (weather route only)
 * @param stage            Terminal stage of the cycle
 * @param error            Failure details, or null on success
 */
public record AgentResponse(
        String sessionId,
        Route route,
        List<String> matchedSignals,
        String answer,
        List<QueryResult> contextUsed,
        WeatherPayload weather,
        AgentStage stage,
        AgentError error
) {
    public static AgentResponse from(AgentState state) {
        RouteDecision decision = state.getRouteDecision();
        List<QueryResult> context = state.getRetrievedContext() == null
                ? List.of()
                : state.getRetrievedContext().chunks().stream().map(QueryResult::from).toList();

        return new AgentResponse(
                state.getSessionId(),
                decision != null ? decision.route() : null,
                decision != null ? decision.matchedKeywords() : List.of(),
                state.getAnswer(),
                context,
                state.getWeather(),
                state.getStage(),
                state.getError()
        );
    }

    public boolean succeeded() {
        return error == null;
    }
}
