package com.anthem.csrfp.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * What the host should do with the request after authorization.
 * The core never ends a response itself; it hands one of these back.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ActionOutcome {

    public enum Kind {
        /** Hand the request on to the application. */
        CONTINUE,
        /** Write {@code status} and {@code body} and stop. */
        RESPOND,
        /** Redirect to {@code location} and stop. */
        REDIRECT
    }

    private static final ActionOutcome PROCEED = new ActionOutcome(Kind.CONTINUE, 0, null, null, null);

    private final Kind kind;
    private final int status;
    private final String body;
    private final String location;

    /** Parameter set removed before continuing, or null if none was. */
    private final RequestType strippedParameters;

    public static ActionOutcome proceed() {
        return PROCEED;
    }

    public static ActionOutcome proceedWithout(RequestType strippedParameters) {
        return new ActionOutcome(Kind.CONTINUE, 0, null, null, strippedParameters);
    }

    public static ActionOutcome respond(int status, String body) {
        return new ActionOutcome(Kind.RESPOND, status, body, null, null);
    }

    public static ActionOutcome redirect(String location) {
        return new ActionOutcome(Kind.REDIRECT, 302, null, location, null);
    }

    public boolean isTerminal() {
        return kind != Kind.CONTINUE;
    }

    public boolean isParametersStripped() {
        return strippedParameters != null;
    }
}
