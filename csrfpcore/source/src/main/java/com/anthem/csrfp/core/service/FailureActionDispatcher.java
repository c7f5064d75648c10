package com.anthem.csrfp.core.service;

import com.anthem.csrfp.core.model.ActionOutcome;
import com.anthem.csrfp.core.model.AttackLogRecord;
import com.anthem.csrfp.core.model.CsrfpConfig;
import com.anthem.csrfp.core.model.FailureAction;
import com.anthem.csrfp.core.model.RequestContext;
import com.anthem.csrfp.core.model.RequestType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Handles a request that failed token validation: records it in the attack
 * log, then picks the configured policy for the request type.
 */
public class FailureActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FailureActionDispatcher.class);

    static final String FORBIDDEN_BODY = "<h2>403 Access Forbidden by CSRFProtector!</h2>";
    static final String INTERNAL_ERROR_BODY = "<h2>500 Internal Server Error!</h2>";

    private final CsrfpConfig config;
    private final AttackLogSink attackLog;
    private final Clock clock;

    public FailureActionDispatcher(CsrfpConfig config, AttackLogSink attackLog, Clock clock) {
        this.config = config;
        this.attackLog = attackLog;
        this.clock = clock;
    }

    /**
     * Log the attack and resolve the failure action.
     *
     * @return a terminal outcome for codes 0, 2, 3 and 4; a continuation with
     *         the request's parameters stripped for code 1 and unknown codes
     * @throws com.anthem.csrfp.core.exception.LogSinkUnavailableException if the attack could not be logged
     */
    public ActionOutcome dispatch(RequestContext request) {
        RequestType requestType = request.getRequestType();

        attackLog.append(AttackLogRecord.of(request, clock.instant()));

        FailureAction action = FailureAction.fromCode(config.failedAuthActionFor(requestType));
        log.warn("CSRF validation failed: method={}, uri={}, requestType={}, action={}",
                request.getMethod(), request.getRequestUri(), requestType, action);

        return switch (action) {
            case BLOCK_FORBIDDEN -> ActionOutcome.respond(403, FORBIDDEN_BODY);
            case REDIRECT -> ActionOutcome.redirect(config.getErrorRedirectionPage());
            case CUSTOM_MESSAGE -> ActionOutcome.respond(200, config.getCustomErrorMessage());
            case INTERNAL_ERROR -> ActionOutcome.respond(500, INTERNAL_ERROR_BODY);
            case STRIP_PARAMETERS -> stripParameters(request, requestType);
        };
    }

    private ActionOutcome stripParameters(RequestContext request, RequestType requestType) {
        request.stripParameters(requestType);
        return ActionOutcome.proceedWithout(requestType);
    }
}
