package com.adlanda.queryagent.model;

import jakarta.validation.constraints.NotNull;

/**
 * Request body for indexing a plain-text document.
 */
public record IndexRequest(
        @NotNull(message = "Text is required")
        String text
) {}
