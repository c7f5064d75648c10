package com.anthem.csrfp.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Verdict for one request together with the action the host must carry out.
 */
@Value
@Builder
public class AuthorizationResult {

    Verdict verdict;
    RequestType requestType;
    ActionOutcome outcome;

    public static AuthorizationResult allowed(RequestType requestType) {
        return new AuthorizationResult(Verdict.ALLOWED, requestType, ActionOutcome.proceed());
    }

    public static AuthorizationResult denied(RequestType requestType, ActionOutcome outcome) {
        return new AuthorizationResult(Verdict.DENIED, requestType, outcome);
    }

    public boolean isAllowed() {
        return verdict == Verdict.ALLOWED;
    }
}
