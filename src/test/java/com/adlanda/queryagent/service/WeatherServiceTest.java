package com.adlanda.queryagent.service;

import com.adlanda.queryagent.config.AgentProperties;
import com.adlanda.queryagent.exception.LocationNotFoundException;
import com.adlanda.queryagent.exception.UpstreamCapabilityException;
import com.adlanda.queryagent.model.WeatherPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WeatherServiceTest {

    private static final String BASE_URL = "https://weather.test/data/2.5";

    private AgentProperties properties;
    private MockRestServiceServer server;
    private WeatherService weatherService;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getWeather().setBaseUrl(BASE_URL);
        properties.getWeather().setApiKey("secret");
        properties.getWeather().setUnits("metric");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        weatherService = new WeatherService(builder, properties);
    }

    @Test
    void fetch_knownLocation_mapsObservation() {
        server.expect(requestTo(startsWith(BASE_URL + "/weather")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("q", "Berlin"))
                .andExpect(queryParam("appid", "secret"))
                .andExpect(queryParam("units", "metric"))
                .andRespond(withSuccess("""
                        {
                          "name": "Berlin",
                          "main": {"temp": 21.5, "feels_like": 20.9, "humidity": 40, "pressure": 1012},
                          "weather": [{"id": 800, "main": "Clear", "description": "clear sky"}],
                          "wind": {"speed": 3.1, "deg": 200}
                        }
                        """, MediaType.APPLICATION_JSON));

        WeatherPayload payload = weatherService.fetch("Berlin");

        assertThat(payload.locationName()).isEqualTo("Berlin");
        assertThat(payload.temperature()).isEqualTo(21.5);
        assertThat(payload.condition()).isEqualTo("clear sky");
        assertThat(payload.feelsLike()).isEqualTo(20.9);
        assertThat(payload.humidity()).isEqualTo(40);
        assertThat(payload.windSpeed()).isEqualTo(3.1);
        assertThat(payload.isEmpty()).isFalse();
        server.verify();
    }

    @Test
    void fetch_missingOptionalFields_usesDefaults() {
        server.expect(requestTo(startsWith(BASE_URL + "/weather")))
                .andRespond(withSuccess("""
                        {"main": {"temp": 5.0}}
                        """, MediaType.APPLICATION_JSON));

        WeatherPayload payload = weatherService.fetch("Oslo");

        assertThat(payload.locationName()).isEqualTo("Oslo");
        assertThat(payload.condition()).isEqualTo("unknown");
        assertThat(payload.windSpeed()).isNull();
    }

    @Test
    void fetch_responseWithoutTemperature_throwsUpstreamFailure() {
        server.expect(requestTo(startsWith(BASE_URL + "/weather")))
                .andRespond(withSuccess("""
                        {"name": "Berlin", "main": {"humidity": 40}}
                        """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> weatherService.fetch("Berlin"))
                .isInstanceOf(UpstreamCapabilityException.class)
                .hasMessageContaining("no temperature data");
    }

    @Test
    void fetch_emptyMainBlock_throwsUpstreamFailure() {
        server.expect(requestTo(startsWith(BASE_URL + "/weather")))
                .andRespond(withSuccess("""
                        {"name": "Berlin", "main": {}}
                        """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> weatherService.fetch("Berlin"))
                .isInstanceOf(UpstreamCapabilityException.class);
    }

    @Test
    void fetch_unknownLocation_throwsLocationNotFound() {
        server.expect(requestTo(startsWith(BASE_URL + "/weather")))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"cod\":\"404\",\"message\":\"city not found\"}"));

        assertThatThrownBy(() -> weatherService.fetch("Atlantis"))
                .isInstanceOf(LocationNotFoundException.class)
                .hasMessageContaining("Atlantis");
    }

    @Test
    void fetch_providerError_throwsUpstreamFailure() {
        server.expect(requestTo(startsWith(BASE_URL + "/weather")))
                .andRespond(withServerError().body("maintenance"));

        assertThatThrownBy(() -> weatherService.fetch("Berlin"))
                .isInstanceOf(UpstreamCapabilityException.class)
                .hasMessageContaining("HTTP 500")
                .hasMessageContaining("maintenance");
    }

    @Test
    void fetch_noApiKey_failsWithoutCallingProvider() {
        properties.getWeather().setApiKey("");
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer unused = MockRestServiceServer.bindTo(builder).build();
        WeatherService unconfigured = new WeatherService(builder, properties);

        assertThatThrownBy(() -> unconfigured.fetch("Berlin"))
                .isInstanceOf(UpstreamCapabilityException.class)
                .hasMessageContaining("API key");
        unused.verify();
    }
}
