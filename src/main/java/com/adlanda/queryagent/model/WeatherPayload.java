package com.adlanda.queryagent.model;

/**
 * Current weather for one location as reported by the weather provider.
 *
 * @param locationName  Location name as resolved by the provider
 * @param temperature   Current temperature in the configured units
 * @param condition     Short description, e.g. "light rain"
 * @param feelsLike     Perceived temperature, if reported
 * @param humidity      Relative humidity in percent, if reported
 * @param windSpeed     Wind speed, if reported
 * @param units         Unit system the values are expressed in (metric, imperial, standard)
 */
public record WeatherPayload(
        String locationName,
        double temperature,
        String condition,
        Double feelsLike,
        Integer humidity,
        Double windSpeed,
        String units
) implements FulfillmentPayload {

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Location: ").append(locationName).append('\n');
        sb.append("Temperature: ").append(temperature).append(' ').append(temperatureUnit()).append('\n');
        sb.append("Condition: ").append(condition);
        if (feelsLike != null) {
            sb.append('\n').append("Feels like: ").append(feelsLike).append(' ').append(temperatureUnit());
        }
        if (humidity != null) {
            sb.append('\n').append("Humidity: ").append(humidity).append('%');
        }
        if (windSpeed != null) {
            sb.append('\n').append("Wind speed: ").append(windSpeed).append(' ').append(windUnit());
        }
        return sb.toString();
    }

    private String temperatureUnit() {
        return switch (units == null ? "" : units) {
            case "imperial" -> "°F";
            case "standard" -> "K";
            default -> "°C";
        };
    }

    private String windUnit() {
        return "imperial".equals(units) ? "mph" : "m/s";
    }
}
