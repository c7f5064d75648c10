package com.anthem.csrfp.core.service;

import com.anthem.csrfp.core.model.ActionOutcome;
import com.anthem.csrfp.core.model.AuthorizationResult;
import com.anthem.csrfp.core.model.CsrfpConfig;
import com.anthem.csrfp.core.model.RequestContext;
import com.anthem.csrfp.core.model.RequestType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;

/**
 * Decides whether a request carries a valid token and rotates the token
 * cookie exactly once per request, whatever the verdict.
 *
 * <p>POST requests are always checked; GET (and any other method) only when
 * GET protection is enabled. A checked request passes when the submitted
 * token and the cookie token are both present and identical.
 */
public class RequestAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(RequestAuthorizer.class);

    private final CsrfpConfig config;
    private final TokenGenerator tokenGenerator;
    private final FailureActionDispatcher failureActionDispatcher;

    public RequestAuthorizer(
            CsrfpConfig config,
            TokenGenerator tokenGenerator,
            FailureActionDispatcher failureActionDispatcher) {
        this.config = config;
        this.tokenGenerator = tokenGenerator;
        this.failureActionDispatcher = failureActionDispatcher;
    }

    public AuthorizationResult authorize(RequestContext request, CookieStore cookieStore) {
        RequestType requestType = request.getRequestType();

        if (!requiresValidation(requestType)
                || tokensMatch(request.getSubmittedToken(), cookieStore.getToken())) {
            rotateToken(cookieStore);
            return AuthorizationResult.allowed(requestType);
        }

        // Rotate before dispatching: the failure action may end the response.
        rotateToken(cookieStore);
        ActionOutcome outcome = failureActionDispatcher.dispatch(request);
        return AuthorizationResult.denied(requestType, outcome);
    }

    public boolean requiresValidation(RequestType requestType) {
        return requestType == RequestType.POST || config.isGetRequestsProtected();
    }

    static boolean tokensMatch(String submitted, String cookie) {
        if (submitted == null || submitted.isEmpty() || cookie == null || cookie.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                submitted.getBytes(StandardCharsets.UTF_8),
                cookie.getBytes(StandardCharsets.UTF_8));
    }

    private void rotateToken(CookieStore cookieStore) {
        cookieStore.setToken(
                tokenGenerator.generate(config.resolvedTokenLength()),
                Duration.ofSeconds(config.getCookieExpirySeconds()));
        log.debug("Token cookie rotated: expiresIn={}s", config.getCookieExpirySeconds());
    }
}
