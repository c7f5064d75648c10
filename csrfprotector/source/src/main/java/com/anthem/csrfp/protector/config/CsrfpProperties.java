package com.anthem.csrfp.protector.config;

import com.anthem.csrfp.core.model.CsrfpConfig;
import com.anthem.csrfp.core.model.InitOverrides;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * {@code csrfp.*} settings from application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "csrfp")
public class CsrfpProperties {

    private boolean enabled = true;

    private boolean getEnabled = false;

    @NotBlank
    private String logDirectory;

    @Valid
    private FailedAuthAction failedAuthAction = new FailedAuthAction();

    private String errorRedirectionPage;

    private String customErrorMessage = "";

    @NotBlank
    private String jsFile;

    private int tokenLength = CsrfpConfig.DEFAULT_TOKEN_LENGTH;

    private String disabledJavascriptMessage = "";

    @Positive
    private long cookieExpirySeconds = CsrfpConfig.DEFAULT_COOKIE_EXPIRY_SECONDS;

    private Init init = new Init();

    public CsrfpConfig toConfig() {
        return CsrfpConfig.builder()
                .getRequestsProtected(getEnabled)
                .logDirectory(Path.of(logDirectory))
                .getFailedAuthAction(failedAuthAction.getGet())
                .postFailedAuthAction(failedAuthAction.getPost())
                .errorRedirectionPage(errorRedirectionPage)
                .customErrorMessage(customErrorMessage)
                .jsResourceUrl(jsFile)
                .tokenLength(tokenLength)
                .disabledJsMessage(disabledJavascriptMessage)
                .cookieExpirySeconds(cookieExpirySeconds)
                .build();
    }

    public InitOverrides toOverrides() {
        return InitOverrides.builder()
                .getEnabled(init.getGetEnabled())
                .tokenLength(init.getTokenLength())
                .action(init.getAction())
                .build();
    }

    /**
     * Failure action codes per request type (0-4, see FailureAction).
     */
    @Data
    public static class FailedAuthAction {
        private int get = 1;
        private int post = 0;
    }

    /**
     * Optional overrides applied over the values above when the protector starts.
     */
    @Data
    public static class Init {
        private Boolean getEnabled;
        private Integer tokenLength;
        private Integer action;
    }
}
