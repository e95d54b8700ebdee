package com.adlanda.queryagent.agent;

import com.adlanda.queryagent.config.AgentProperties;
import com.adlanda.queryagent.model.Route;
import com.adlanda.queryagent.model.RouteDecision;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword-based query classifier.
 *
 * Weather keywords take precedence: a query mentioning one is routed to the
 * weather lookup even when a document is indexed. Any other query is answered
 * from the indexed document if there is one, and is unsupported otherwise.
 */
@Component
public class QueryRouter {

    private final Map<String, Pattern> weatherPatterns;

    @Autowired
    public QueryRouter(AgentProperties properties) {
        this(properties.getRouter().getWeatherKeywords());
    }

    QueryRouter(List<String> weatherKeywords) {
        this.weatherPatterns = weatherKeywords.stream()
                .map(k -> k.strip().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .distinct()
                .collect(Collectors.toMap(
                        k -> k,
                        k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b",
                                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                        (a, b) -> a,
                        LinkedHashMap::new));
    }

    /**
     * Chooses the fulfillment path for a query. Pure and deterministic.
     *
     * @param query          The user's question
     * @param indexAvailable Whether the session currently has an indexed document
     */
    public RouteDecision classify(String query, boolean indexAvailable) {
        List<String> matched = weatherPatterns.entrySet().stream()
                .filter(e -> e.getValue().matcher(query).find())
                .map(Map.Entry::getKey)
                .toList();

        if (!matched.isEmpty()) {
            return new RouteDecision(Route.WEATHER, matched, indexAvailable);
        }
        return new RouteDecision(indexAvailable ? Route.RAG : Route.UNSUPPORTED, List.of(), indexAvailable);
    }
}
