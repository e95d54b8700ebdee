package com.adlanda.queryagent.agent;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a location phrase such as "in Paris" or "for New York" from a weather query.
 */
@Component
public class LocationParser {

    private static final Pattern ANCHOR = Pattern.compile("\\b(?:in|for)\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern PHRASE = Pattern.compile("[\\p{L}0-9][\\p{L}0-9\\s,.'\\-]*");

    private static final Pattern NEXT_ANCHOR = Pattern.compile("\\s+(?:in|for)\\s+", Pattern.CASE_INSENSITIVE);

    private static final String TIME_WORDS = "right now|today|tomorrow|tonight|now|this week|this weekend|currently";

    private static final Pattern LEADING_TIME_WORDS = Pattern.compile(
            "^(?:" + TIME_WORDS + ")\\b[\\s,.]*", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_TIME_WORDS = Pattern.compile(
            "(?:[\\s,]+(?:" + TIME_WORDS + "))+$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.,;:'\\-]+$");

    /**
     * Returns the location named by the query, if any.
     *
     * Each "in"/"for" anchor is tried in order. Its phrase runs up to sentence
     * punctuation or the next anchor, minus time words at either end; the first
     * phrase with anything left is the location.
     */
    public Optional<String> parse(String query) {
        Matcher anchor = ANCHOR.matcher(query);
        while (anchor.find()) {
            Matcher phrase = PHRASE.matcher(query).region(anchor.end(), query.length());
            if (!phrase.lookingAt()) {
                continue;
            }

            String candidate = phrase.group();
            Matcher next = NEXT_ANCHOR.matcher(candidate);
            if (next.find()) {
                candidate = candidate.substring(0, next.start());
            }

            String cleaned = clean(candidate);
            if (!cleaned.isEmpty()) {
                return Optional.of(cleaned);
            }
        }
        return Optional.empty();
    }

    private String clean(String raw) {
        String loc = raw.strip();
        String previous;
        do {
            previous = loc;
            loc = LEADING_TIME_WORDS.matcher(loc).replaceFirst("");
            loc = TRAILING_PUNCTUATION.matcher(loc).replaceAll("");
            loc = TRAILING_TIME_WORDS.matcher(" " + loc).replaceAll("").strip();
        } while (!loc.equals(previous));
        return loc;
    }
}
