package com.anthem.csrfp.core.model;

/**
 * Which parameter set a request's token is expected in.
 * Only POST is treated as state-changing; every other method follows the GET rules.
 */
public enum RequestType {
    GET,
    POST;

    public static RequestType fromMethod(String method) {
        return "POST".equalsIgnoreCase(method) ? POST : GET;
    }
}
