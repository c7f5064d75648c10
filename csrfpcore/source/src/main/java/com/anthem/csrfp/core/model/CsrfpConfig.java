package com.anthem.csrfp.core.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Resolved protector configuration. Built once at startup and shared
 * read-only by every component for the lifetime of the process.
 */
@Value
@Builder(toBuilder = true)
public class CsrfpConfig {

    public static final int DEFAULT_TOKEN_LENGTH = 32;
    public static final long DEFAULT_COOKIE_EXPIRY_SECONDS = 300;

    boolean getRequestsProtected;

    Path logDirectory;

    @Builder.Default
    int getFailedAuthAction = FailureAction.STRIP_PARAMETERS.getCode();

    @Builder.Default
    int postFailedAuthAction = FailureAction.BLOCK_FORBIDDEN.getCode();

    String errorRedirectionPage;

    @Builder.Default
    String customErrorMessage = "";

    String jsResourceUrl;

    @Builder.Default
    int tokenLength = DEFAULT_TOKEN_LENGTH;

    @Builder.Default
    String disabledJsMessage = "";

    @Builder.Default
    long cookieExpirySeconds = DEFAULT_COOKIE_EXPIRY_SECONDS;

    public int failedAuthActionFor(RequestType requestType) {
        return requestType == RequestType.POST ? postFailedAuthAction : getFailedAuthAction;
    }

    public int resolvedTokenLength() {
        return resolveTokenLength(tokenLength);
    }

    public static int resolveTokenLength(int length) {
        return length > 0 ? length : DEFAULT_TOKEN_LENGTH;
    }

    public CsrfpConfig withOverrides(InitOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        CsrfpConfigBuilder builder = toBuilder();
        if (Boolean.TRUE.equals(overrides.getGetEnabled())) {
            builder.getRequestsProtected(true);
        }
        if (overrides.getTokenLength() != null) {
            builder.tokenLength(resolveTokenLength(overrides.getTokenLength()));
        }
        if (overrides.getAction() != null) {
            builder.getFailedAuthAction(overrides.getAction())
                    .postFailedAuthAction(overrides.getAction());
        }
        return builder.build();
    }
}
