package com.anthem.csrfp.protector.config;

import com.anthem.csrfp.core.CsrfProtector;
import com.anthem.csrfp.core.exception.ConfigurationException;
import com.anthem.csrfp.core.model.CsrfpConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CsrfProtectorConfigTest {

    @TempDir
    Path logDirectory;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(CsrfProtectorConfig.class);

    @Test
    void validProperties_createProtectorAndFilter() {
        contextRunner
                .withPropertyValues(
                        "csrfp.log-directory=" + logDirectory,
                        "csrfp.js-file=/js/csrfprotector.js",
                        "csrfp.token-length=16")
                .run(context -> {
                    assertThat(context).hasSingleBean(CsrfProtector.class);
                    assertThat(context).hasSingleBean(FilterRegistrationBean.class);
                    CsrfpConfig config = context.getBean(CsrfProtector.class).getConfig();
                    assertThat(config.getLogDirectory()).isEqualTo(logDirectory);
                    assertThat(config.resolvedTokenLength()).isEqualTo(16);
                    assertThat(config.isGetRequestsProtected()).isFalse();
                    assertThat(config.getGetFailedAuthAction()).isEqualTo(1);
                    assertThat(config.getPostFailedAuthAction()).isEqualTo(0);
                    FilterRegistrationBean<?> registration = context.getBean(FilterRegistrationBean.class);
                    assertThat(registration.getUrlPatterns()).containsExactly("/*");
                });
    }

    @Test
    void initOverrides_replaceLoadedValues() {
        contextRunner
                .withPropertyValues(
                        "csrfp.log-directory=" + logDirectory,
                        "csrfp.js-file=/js/csrfprotector.js",
                        "csrfp.custom-error-message=Denied",
                        "csrfp.init.get-enabled=true",
                        "csrfp.init.action=3")
                .run(context -> {
                    CsrfpConfig config = context.getBean(CsrfProtector.class).getConfig();
                    assertThat(config.isGetRequestsProtected()).isTrue();
                    assertThat(config.getGetFailedAuthAction()).isEqualTo(3);
                    assertThat(config.getPostFailedAuthAction()).isEqualTo(3);
                });
    }

    @Test
    void everyProperty_bindsIntoConfig() {
        contextRunner
                .withPropertyValues(
                        "csrfp.log-directory=" + logDirectory,
                        "csrfp.js-file=/static/csrfp.js",
                        "csrfp.get-enabled=true",
                        "csrfp.failed-auth-action.get=4",
                        "csrfp.failed-auth-action.post=2",
                        "csrfp.error-redirection-page=https://example.org/denied",
                        "csrfp.custom-error-message=Nope",
                        "csrfp.disabled-javascript-message=Turn on JS",
                        "csrfp.cookie-expiry-seconds=600")
                .run(context -> {
                    assertThat(context.getBean(CsrfpProperties.class).isGetEnabled()).isTrue();
                    CsrfpConfig config = context.getBean(CsrfProtector.class).getConfig();
                    assertThat(config.isGetRequestsProtected()).isTrue();
                    assertThat(config.getJsResourceUrl()).isEqualTo("/static/csrfp.js");
                    assertThat(config.getGetFailedAuthAction()).isEqualTo(4);
                    assertThat(config.getPostFailedAuthAction()).isEqualTo(2);
                    assertThat(config.getErrorRedirectionPage()).isEqualTo("https://example.org/denied");
                    assertThat(config.getCustomErrorMessage()).isEqualTo("Nope");
                    assertThat(config.getDisabledJsMessage()).isEqualTo("Turn on JS");
                    assertThat(config.getCookieExpirySeconds()).isEqualTo(600);
                });
    }

    @Test
    void missingLogDirectory_failsStartup() {
        contextRunner
                .withPropertyValues(
                        "csrfp.log-directory=" + logDirectory.resolve("does-not-exist"),
                        "csrfp.js-file=/js/csrfprotector.js")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(ConfigurationException.class);
                });
    }

    @Test
    void redirectWithoutPage_failsStartup() {
        contextRunner
                .withPropertyValues(
                        "csrfp.log-directory=" + logDirectory,
                        "csrfp.js-file=/js/csrfprotector.js",
                        "csrfp.failed-auth-action.post=2")
                .run(context -> assertThat(context.getStartupFailure())
                        .hasRootCauseInstanceOf(ConfigurationException.class));
    }

    @Test
    void missingJsFile_failsValidation() {
        contextRunner
                .withPropertyValues("csrfp.log-directory=" + logDirectory)
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void disabled_registersNothing() {
        contextRunner
                .withPropertyValues("csrfp.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(CsrfProtector.class);
                    assertThat(context).doesNotHaveBean(FilterRegistrationBean.class);
                });
    }
}
