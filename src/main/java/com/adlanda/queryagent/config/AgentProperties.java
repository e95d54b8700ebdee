package com.adlanda.queryagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for routing, indexing, retrieval and the weather provider.
 *
 * Maps to properties prefixed with 'agent' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    private final Rag rag = new Rag();
    private final Router router = new Router();
    private final Weather weather = new Weather();
    private final Preload preload = new Preload();

    public Rag getRag() {
        return rag;
    }

    public Router getRouter() {
        return router;
    }

    public Weather getWeather() {
        return weather;
    }

    public Preload getPreload() {
        return preload;
    }

    public static class Rag {

        /**
         * Target chunk length in characters.
         */
        private int chunkSize = 800;

        /**
         * Characters shared by consecutive chunks. Must be smaller than the chunk size.
         */
        private int chunkOverlap = 100;

        /**
         * Number of chunks retrieved per query when the request does not say.
         */
        private int topK = 8;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }
    }

    public static class Router {

        /**
         * Words that mark a query as a weather question. Matched case-insensitively on word boundaries.
         */
        private List<String> weatherKeywords = new ArrayList<>(List.of("weather", "temperature", "forecast"));

        public List<String> getWeatherKeywords() {
            return weatherKeywords;
        }

        public void setWeatherKeywords(List<String> weatherKeywords) {
            this.weatherKeywords = weatherKeywords;
        }
    }

    public static class Weather {

        private String baseUrl = "https://api.openweathermap.org/data/2.5";

        private String apiKey;

        /**
         * OpenWeatherMap unit system: metric, imperial or standard.
         */
        private String units = "metric";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getUnits() {
            return units;
        }

        public void setUnits(String units) {
            this.units = units;
        }
    }

    public static class Preload {

        /**
         * Whether to index a document from disk at startup.
         */
        private boolean enabled = false;

        private String path;

        private String sessionId = "default";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getSessionId() {
            return sessionId;
        }

        public void setSessionId(String sessionId) {
            this.sessionId = sessionId;
        }
    }
}
