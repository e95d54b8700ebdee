package com.adlanda.queryagent.service;

import com.adlanda.queryagent.config.AgentProperties;
import com.adlanda.queryagent.exception.LocationNotFoundException;
import com.adlanda.queryagent.exception.UpstreamCapabilityException;
import com.adlanda.queryagent.model.WeatherPayload;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;

/**
 * Client for the OpenWeatherMap current-weather API.
 */
@Service
public class WeatherService {

    private static final Logger log = LoggerFactory.getLogger(WeatherService.class);

    private final RestClient restClient;
    private final String apiKey;
    private final String units;

    public WeatherService(RestClient.Builder restClientBuilder, AgentProperties properties) {
        AgentProperties.Weather weather = properties.getWeather();
        this.restClient = restClientBuilder.baseUrl(weather.getBaseUrl()).build();
        this.apiKey = weather.getApiKey();
        this.units = weather.getUnits();
    }

    /**
     * Fetches the current weather for a location.
     *
     * @param location Free-form location, e.g. "Berlin" or "Paris, FR"
     * @throws LocationNotFoundException if the provider does not know the location
     * @throws UpstreamCapabilityException if the API key is missing or the call fails
     */
    public WeatherPayload fetch(String location) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new UpstreamCapabilityException("weather", "OpenWeather API key is not configured");
        }

        log.info("Fetching current weather for '{}'", location);
        CurrentWeather body;
        try {
            body = restClient.get()
                    .uri(uri -> uri.path("/weather")
                            .queryParam("q", location)
                            .queryParam("appid", apiKey)
                            .queryParam("units", units)
                            .build())
                    .retrieve()
                    .body(CurrentWeather.class);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                throw new LocationNotFoundException("Weather provider does not know the location '" + location + "'");
            }
            throw new UpstreamCapabilityException("weather",
                    "HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString());
        } catch (RestClientException e) {
            throw new UpstreamCapabilityException("weather", e);
        }

        if (body == null || body.main() == null || body.main().temp() == null) {
            throw new UpstreamCapabilityException("weather", "response had no temperature data");
        }
        return toPayload(body, location);
    }

    private WeatherPayload toPayload(CurrentWeather body, String requestedLocation) {
        String condition = body.weather() == null || body.weather().isEmpty()
                ? "unknown"
                : body.weather().get(0).description();
        String name = body.name() == null || body.name().isBlank() ? requestedLocation : body.name();

        return new WeatherPayload(
                name,
                body.main().temp(),
                condition,
                body.main().feelsLike(),
                body.main().humidity(),
                body.wind() != null ? body.wind().speed() : null,
                units
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CurrentWeather(String name, Main main, List<Condition> weather, Wind wind) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Main(Double temp, @JsonProperty("feels_like") Double feelsLike, Integer humidity) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Condition(String main, String description) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Wind(Double speed) {}
}
