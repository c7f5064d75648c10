package com.anthem.csrfp.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One line of the attack log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"timestamp", "host", "request_uri", "request_type", "query", "cookie"})
public class AttackLogRecord {

    /** Epoch seconds. */
    private long timestamp;

    private String host;

    @JsonProperty("request_uri")
    private String requestUri;

    @JsonProperty("request_type")
    private RequestType requestType;

    /** Parameters of the request type that failed validation. */
    private Map<String, List<String>> query;

    private Map<String, String> cookie;

    public static AttackLogRecord of(RequestContext request, Instant at) {
        return AttackLogRecord.builder()
                .timestamp(at.getEpochSecond())
                .host(request.getHost())
                .requestUri(request.getRequestUri())
                .requestType(request.getRequestType())
                .query(new LinkedHashMap<>(request.getParameters()))
                .cookie(request.getCookies())
                .build();
    }
}
