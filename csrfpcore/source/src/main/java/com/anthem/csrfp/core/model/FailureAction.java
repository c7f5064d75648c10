package com.anthem.csrfp.core.model;

import java.util.Arrays;

/**
 * Response policies for a denied request, keyed by the configured integer code.
 */
public enum FailureAction {

    /** 403 with a fixed body. */
    BLOCK_FORBIDDEN(0),

    /** Drop the parameters of the request type and let the request through. */
    STRIP_PARAMETERS(1),

    /** Redirect to the configured error page. */
    REDIRECT(2),

    /** Send the configured custom message as the body. */
    CUSTOM_MESSAGE(3),

    /** 500 with a fixed body. */
    INTERNAL_ERROR(4);

    private final int code;

    FailureAction(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Unknown codes fall back to {@link #STRIP_PARAMETERS}.
     */
    public static FailureAction fromCode(int code) {
        return Arrays.stream(values())
                .filter(action -> action.code == code)
                .findFirst()
                .orElse(STRIP_PARAMETERS);
    }
}
