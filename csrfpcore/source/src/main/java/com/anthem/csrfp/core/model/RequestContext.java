package com.anthem.csrfp.core.model;

import com.anthem.csrfp.core.CsrfpConstants;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the protector sees of one incoming request. Created by the host
 * integration at request start and owned by the authorization pipeline
 * until the request ends.
 */
@Getter
@ToString(exclude = "cookies")
public class RequestContext {

    private final String method;
    private final String host;
    private final String requestUri;
    private final Map<String, List<String>> queryParameters;
    private final Map<String, List<String>> bodyParameters;
    private final Map<String, String> cookies;

    @Builder
    private RequestContext(
            String method,
            String host,
            String requestUri,
            Map<String, List<String>> queryParameters,
            Map<String, List<String>> bodyParameters,
            Map<String, String> cookies) {
        this.method = method;
        this.host = host;
        this.requestUri = requestUri;
        this.queryParameters = copyOf(queryParameters);
        this.bodyParameters = copyOf(bodyParameters);
        this.cookies = cookies != null ? Map.copyOf(cookies) : Map.of();
    }

    public Map<String, List<String>> getQueryParameters() {
        return Collections.unmodifiableMap(queryParameters);
    }

    public Map<String, List<String>> getBodyParameters() {
        return Collections.unmodifiableMap(bodyParameters);
    }

    public RequestType getRequestType() {
        return RequestType.fromMethod(method);
    }

    /**
     * Parameters the token is looked up in: the body for POST, the query string otherwise.
     */
    public Map<String, List<String>> getParameters() {
        return parametersFor(getRequestType());
    }

    public Map<String, List<String>> parametersFor(RequestType requestType) {
        return requestType == RequestType.POST ? getBodyParameters() : getQueryParameters();
    }

    /**
     * First submitted value of the token field, or null.
     */
    public String getSubmittedToken() {
        List<String> values = getParameters().get(CsrfpConstants.TOKEN_PARAMETER_NAME);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    /**
     * Forget every parameter of the given type.
     */
    public void stripParameters(RequestType requestType) {
        if (requestType == RequestType.POST) {
            bodyParameters.clear();
        } else {
            queryParameters.clear();
        }
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        return copy;
    }
}
