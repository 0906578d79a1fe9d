package com.foundryrelay.app.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON error body returned by the REST facade.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String error, String message) {

    public static ApiErrorResponse of(String error) {
        return new ApiErrorResponse(error, null);
    }
}
