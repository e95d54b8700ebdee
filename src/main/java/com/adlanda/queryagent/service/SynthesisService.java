package com.adlanda.queryagent.service;

import com.adlanda.queryagent.model.FulfillmentPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a query plus its fulfillment payload into the final answer.
 *
 * The model is instructed to answer from the supplied context only. An empty
 * payload short-circuits to a fixed reply and the model is not called.
 */
@Service
public class SynthesisService {

    private static final Logger log = LoggerFactory.getLogger(SynthesisService.class);

    static final String SYSTEM_PROMPT = """
            You are a helpful assistant. Answer the question using only the context \
            provided below. Do not introduce facts, figures or names that are not in \
            the context. If the context does not contain the answer, say that you do \
            not know. Keep the answer concise and suitable for a non-technical reader.""";

    static final String INSUFFICIENT_CONTEXT_TEMPLATE =
            "I could not find any relevant information in the indexed document for the query: '%s'. "
                    + "Please try rephrasing or confirm that the document was indexed successfully.";

    private final CompletionService completionService;

    public SynthesisService(CompletionService completionService) {
        this.completionService = completionService;
    }

    public String synthesize(String query, FulfillmentPayload context) {
        if (context == null || context.isEmpty()) {
            log.info("No context available for query, returning insufficient-context answer");
            return insufficientContextAnswer(query);
        }

        return completionService.complete(SYSTEM_PROMPT, buildUserPrompt(query, context));
    }

    String buildUserPrompt(String query, FulfillmentPayload context) {
        return "Question: " + query + "\n\nContext:\n" + context.render();
    }

    public static String insufficientContextAnswer(String query) {
        return String.format(INSUFFICIENT_CONTEXT_TEMPLATE, query);
    }
}
