package com.foundryrelay.gateway.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A managed API key as stored in the key file.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiKey {
    private String id;
    private String key;
    private String name;
    /** ISO-8601 instant. */
    private String createdAt;
    /** ISO-8601 instant of the last successful validation. */
    private String lastUsed;
    private boolean active;
    private Map<String, Object> metadata;
}
