package com.adlanda.queryagent.model;

/**
 * Material an answer may be derived from.
 *
 * The synthesizer only sees this view, so it treats retrieved document text and
 * live weather data the same way.
 */
public interface FulfillmentPayload {

    /**
     * Returns true if there is nothing to ground an answer on.
     */
    boolean isEmpty();

    /**
     * Renders the payload as prompt context, verbatim.
     */
    String render();
}
