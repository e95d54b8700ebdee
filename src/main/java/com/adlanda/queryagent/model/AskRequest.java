package com.adlanda.queryagent.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the ask endpoint. {@code topK} falls back to the configured default when absent.
 */
public record AskRequest(
        @NotBlank(message = "Question is required")
        String question,

        @Min(1) @Max(20)
        Integer topK
) {}
