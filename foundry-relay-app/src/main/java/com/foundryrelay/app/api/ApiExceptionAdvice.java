package com.foundryrelay.app.api;

import com.foundryrelay.gateway.protocol.RelayErrorCode;
import com.foundryrelay.gateway.protocol.RelayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps relay and request failures to JSON error responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionAdvice {

    /**
     * Relay failures: peer missing, delivery, timeout, expiry, peer error.
     */
    @ExceptionHandler(RelayException.class)
    public ResponseEntity<ApiErrorResponse> relayFailure(RelayException e) {
        RelayErrorCode code = e.getCode();
        return switch (code) {
            case NO_PEER_CONNECTED -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ApiErrorResponse("No FoundryVTT instances connected",
                            "Please ensure FoundryVTT is running and the module is connected to this relay server"));
            case DELIVERY_FAILURE -> {
                log.error("http:relay delivery failed: {}", e.getMessage());
                yield ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(new ApiErrorResponse("Delivery failed", e.getMessage()));
            }
            case REQUEST_TIMEOUT -> ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(new ApiErrorResponse("Request timeout", e.getMessage()));
            case REQUEST_EXPIRED -> ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(new ApiErrorResponse("Request expired", e.getMessage()));
            case PEER_ERROR -> ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ApiErrorResponse("FoundryVTT error", e.getMessage()));
            default -> {
                log.error("http:relay unexpected failure code={}: {}", code, e.getMessage(), e);
                yield ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(ApiErrorResponse.of("Internal server error"));
            }
        };
    }

    /**
     * Missing required request fields.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ApiErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ApiErrorResponse.of("Invalid JSON body"));
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<ApiErrorResponse> notFound(Exception e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiErrorResponse.of("Endpoint not found"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> internalError(Exception e) {
        log.error("http:error {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiErrorResponse.of("Internal server error"));
    }
}
