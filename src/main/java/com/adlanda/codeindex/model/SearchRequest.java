package com.adlanda.codeindex.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for the search endpoint.
 */
public record SearchRequest(
        @NotNull(message = "Query vector is required")
        float[] query,

        @Min(1) @Max(100)
        Integer k
) {
    public SearchRequest {
        if (k == null) {
            k = 5;
        }
    }
}
