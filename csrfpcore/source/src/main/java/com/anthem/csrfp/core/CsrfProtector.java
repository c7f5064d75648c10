package com.anthem.csrfp.core;

import com.anthem.csrfp.core.exception.ConfigurationException;
import com.anthem.csrfp.core.model.AuthorizationResult;
import com.anthem.csrfp.core.model.CsrfpConfig;
import com.anthem.csrfp.core.model.FailureAction;
import com.anthem.csrfp.core.model.InitOverrides;
import com.anthem.csrfp.core.model.RequestContext;
import com.anthem.csrfp.core.service.AttackLogSink;
import com.anthem.csrfp.core.service.CookieStore;
import com.anthem.csrfp.core.service.FailureActionDispatcher;
import com.anthem.csrfp.core.service.FileAttackLogSink;
import com.anthem.csrfp.core.service.HtmlRewriter;
import com.anthem.csrfp.core.service.RequestAuthorizer;
import com.anthem.csrfp.core.service.TokenGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Clock;

/**
 * Entry point of the protector. Built once per process by {@link #init};
 * the host then calls {@link #authorize} for every incoming request and
 * runs the response body through {@link #newRewriter()}.
 */
public class CsrfProtector {

    private static final Logger log = LoggerFactory.getLogger(CsrfProtector.class);

    private final CsrfpConfig config;
    private final RequestAuthorizer authorizer;

    CsrfProtector(CsrfpConfig config, RequestAuthorizer authorizer) {
        this.config = config;
        this.authorizer = authorizer;
    }

    public static CsrfProtector init(CsrfpConfig loaded, InitOverrides overrides) {
        CsrfpConfig config = resolve(loaded, overrides);
        return build(config, new FileAttackLogSink(config.getLogDirectory()), Clock.systemDefaultZone());
    }

    public static CsrfProtector init(CsrfpConfig loaded, InitOverrides overrides, AttackLogSink attackLog, Clock clock) {
        return build(resolve(loaded, overrides), attackLog, clock);
    }

    private static CsrfProtector build(CsrfpConfig config, AttackLogSink attackLog, Clock clock) {
        FailureActionDispatcher dispatcher = new FailureActionDispatcher(config, attackLog, clock);
        RequestAuthorizer authorizer = new RequestAuthorizer(config, new TokenGenerator(), dispatcher);

        log.info("CSRF protector initialized: getProtected={}, getAction={}, postAction={}, tokenLength={}, logDirectory={}",
                config.isGetRequestsProtected(),
                FailureAction.fromCode(config.getGetFailedAuthAction()),
                FailureAction.fromCode(config.getPostFailedAuthAction()),
                config.resolvedTokenLength(),
                config.getLogDirectory());
        return new CsrfProtector(config, authorizer);
    }

    /**
     * Apply call-site overrides and check that what remains is usable.
     *
     * @throws ConfigurationException if no config was loaded, a required value
     *         is missing or the log directory does not exist
     */
    static CsrfpConfig resolve(CsrfpConfig loaded, InitOverrides overrides) {
        if (loaded == null) {
            throw new ConfigurationException("Configuration not found for CSRFProtector");
        }
        CsrfpConfig config = loaded.withOverrides(overrides);

        if (config.getLogDirectory() == null) {
            throw new ConfigurationException("Log directory is not configured");
        }
        if (!Files.isDirectory(config.getLogDirectory())) {
            throw new ConfigurationException("Log directory not found: " + config.getLogDirectory());
        }
        if (config.getJsResourceUrl() == null || config.getJsResourceUrl().isBlank()) {
            throw new ConfigurationException("Client script URL is not configured");
        }
        if (config.getCookieExpirySeconds() <= 0) {
            throw new ConfigurationException("Cookie expiry must be positive: " + config.getCookieExpirySeconds());
        }
        if (usesRedirect(config) && (config.getErrorRedirectionPage() == null
                || config.getErrorRedirectionPage().isBlank())) {
            throw new ConfigurationException("Redirect failure action requires an error redirection page");
        }
        return config;
    }

    private static boolean usesRedirect(CsrfpConfig config) {
        return FailureAction.fromCode(config.getGetFailedAuthAction()) == FailureAction.REDIRECT
                || FailureAction.fromCode(config.getPostFailedAuthAction()) == FailureAction.REDIRECT;
    }

    public AuthorizationResult authorize(RequestContext request, CookieStore cookieStore) {
        return authorizer.authorize(request, cookieStore);
    }

    /**
     * Fresh rewriter for one response.
     */
    public HtmlRewriter newRewriter() {
        return new HtmlRewriter(config.getJsResourceUrl(), config.getDisabledJsMessage());
    }

    public CsrfpConfig getConfig() {
        return config;
    }
}
