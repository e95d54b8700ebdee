package com.adlanda.queryagent.agent;

import com.adlanda.queryagent.config.AgentProperties;
import com.adlanda.queryagent.exception.AgentException;
import com.adlanda.queryagent.exception.ErrorKind;
import com.adlanda.queryagent.exception.LocationNotFoundException;
import com.adlanda.queryagent.exception.NoIndexException;
import com.adlanda.queryagent.exception.UnroutableQueryException;
import com.adlanda.queryagent.model.AgentResponse;
import com.adlanda.queryagent.model.AgentState;
import com.adlanda.queryagent.model.IndexHandle;
import com.adlanda.queryagent.model.RetrievedContext;
import com.adlanda.queryagent.model.RouteDecision;
import com.adlanda.queryagent.model.WeatherPayload;
import com.adlanda.queryagent.repository.SessionIndexRegistry;
import com.adlanda.queryagent.service.RetrievalService;
import com.adlanda.queryagent.service.SynthesisService;
import com.adlanda.queryagent.service.WeatherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one query-answer cycle as a fixed sequence of stages.
 *
 * <pre>
 * START -> ROUTED -> FULFILLED -> ANSWERED
 *   \________\___________\______> ERROR
 * </pre>
 *
 * Each stage runs at most once and nothing is retried. A failure in any stage
 * ends the cycle in ERROR with the failure recorded on the state; the caller
 * receives it in the response instead of an exception.
 */
@Service
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    private final QueryRouter router;
    private final LocationParser locationParser;
    private final WeatherService weatherService;
    private final RetrievalService retrievalService;
    private final SynthesisService synthesisService;
    private final SessionIndexRegistry registry;
    private final int defaultTopK;

    public AgentExecutor(QueryRouter router,
                         LocationParser locationParser,
                         WeatherService weatherService,
                         RetrievalService retrievalService,
                         SynthesisService synthesisService,
                         SessionIndexRegistry registry,
                         AgentProperties properties) {
        this.router = router;
        this.locationParser = locationParser;
        this.weatherService = weatherService;
        this.retrievalService = retrievalService;
        this.synthesisService = synthesisService;
        this.registry = registry;
        this.defaultTopK = properties.getRag().getTopK();
    }

    public AgentResponse answer(String query, String sessionId) {
        return answer(query, sessionId, defaultTopK);
    }

    /**
     * Answers a query for a session.
     *
     * @param query     The user's question
     * @param sessionId Session whose indexed document may be used
     * @param topK      Maximum number of chunks retrieved on the RAG route
     * @return The terminal state of the cycle; {@code answer} is null whenever {@code error} is set
     */
    public AgentResponse answer(String query, String sessionId, int topK) {
        AgentState state = new AgentState(sessionId, query);
        // Captured once so routing and retrieval see the same index
        IndexHandle handle = registry.find(sessionId).orElse(null);

        try {
            route(state, handle);
            fulfill(state, handle, topK);
            synthesize(state);
        } catch (AgentException e) {
            log.warn("Query cycle for session {} failed in stage {}: {} - {}",
                    sessionId, state.getStage(), e.getKind(), e.getMessage());
            state.failed(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure in stage {} for session {}", state.getStage(), sessionId, e);
            state.failed(ErrorKind.INTERNAL, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        return AgentResponse.from(state);
    }

    private void route(AgentState state, IndexHandle handle) {
        RouteDecision decision = router.classify(state.getQuery(), handle != null);
        state.routed(decision);
        log.info("Routed query for session {} to {} (signals: {}, index available: {})",
                state.getSessionId(), decision.route(), decision.matchedKeywords(), decision.indexAvailable());
    }

    private void fulfill(AgentState state, IndexHandle handle, int topK) {
        switch (state.getRouteDecision().route()) {
            case WEATHER -> {
                String location = locationParser.parse(state.getQuery())
                        .orElseThrow(() -> new LocationNotFoundException(
                                "Could not find a location in the query; try e.g. 'weather in Paris'"));
                WeatherPayload weather = weatherService.fetch(location);
                state.fulfilledByWeather(weather);
            }
            case RAG -> {
                if (handle == null) {
                    throw new NoIndexException(state.getSessionId());
                }
                RetrievedContext context = retrievalService.retrieve(state.getQuery(), handle, topK);
                state.fulfilledByRetrieval(context);
            }
            case UNSUPPORTED -> throw new UnroutableQueryException(state.getQuery());
        }
    }

    private void synthesize(AgentState state) {
        String answer = synthesisService.synthesize(state.getQuery(), state.fulfillment());
        state.answered(answer);
    }
}
