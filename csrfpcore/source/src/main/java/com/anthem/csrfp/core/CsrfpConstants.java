package com.anthem.csrfp.core;

/**
 * Fixed names shared by the server side and the client-side script.
 * Neither is configurable: the script hard-codes both.
 */
public final class CsrfpConstants {

    /** Name of the cookie carrying the current token. */
    public static final String TOKEN_COOKIE_NAME = "CSRF_AUTH_TOKEN";

    /** Name of the form/query field the client submits the token in. */
    public static final String TOKEN_PARAMETER_NAME = "CSRFPROTECTOR_AUTH_TOKEN";

    private CsrfpConstants() {
    }
}
