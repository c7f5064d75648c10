package com.anthem.csrfp.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CsrfpConfigTest {

    private final CsrfpConfig config = CsrfpConfig.builder()
            .logDirectory(Path.of("log"))
            .jsResourceUrl("/js/csrfprotector.js")
            .build();

    @Test
    void defaults_matchDocumentedValues() {
        assertThat(config.isGetRequestsProtected()).isFalse();
        assertThat(config.getGetFailedAuthAction()).isEqualTo(1);
        assertThat(config.getPostFailedAuthAction()).isEqualTo(0);
        assertThat(config.getTokenLength()).isEqualTo(32);
        assertThat(config.getCookieExpirySeconds()).isEqualTo(300);
        assertThat(config.getCustomErrorMessage()).isEmpty();
    }

    @Test
    void failedAuthActionFor_picksCodeByRequestType() {
        CsrfpConfig custom = config.toBuilder().getFailedAuthAction(3).postFailedAuthAction(2).build();

        assertThat(custom.failedAuthActionFor(RequestType.GET)).isEqualTo(3);
        assertThat(custom.failedAuthActionFor(RequestType.POST)).isEqualTo(2);
    }

    @Test
    void resolvedTokenLength_nonPositiveFallsBackTo32() {
        assertThat(config.toBuilder().tokenLength(0).build().resolvedTokenLength()).isEqualTo(32);
        assertThat(config.toBuilder().tokenLength(-5).build().resolvedTokenLength()).isEqualTo(32);
        assertThat(config.toBuilder().tokenLength(10).build().resolvedTokenLength()).isEqualTo(10);
    }

    @Test
    void withOverrides_falseGetFlag_doesNotDisableProtection() {
        CsrfpConfig protectedGet = config.toBuilder().getRequestsProtected(true).build();

        CsrfpConfig result = protectedGet.withOverrides(InitOverrides.builder().getEnabled(false).build());

        assertThat(result.isGetRequestsProtected()).isTrue();
    }

    @Test
    void withOverrides_nonPositiveLength_resolvesToDefault() {
        CsrfpConfig result = config.withOverrides(InitOverrides.builder().tokenLength(-1).build());

        assertThat(result.getTokenLength()).isEqualTo(32);
    }

    @Test
    void withOverrides_noneOrNull_keepsConfig() {
        assertThat(config.withOverrides(InitOverrides.NONE)).isEqualTo(config);
        assertThat(config.withOverrides(null)).isSameAs(config);
    }

    @Test
    void failureAction_unknownCodeFallsBackToStrip() {
        assertThat(FailureAction.fromCode(0)).isEqualTo(FailureAction.BLOCK_FORBIDDEN);
        assertThat(FailureAction.fromCode(4)).isEqualTo(FailureAction.INTERNAL_ERROR);
        assertThat(FailureAction.fromCode(-1)).isEqualTo(FailureAction.STRIP_PARAMETERS);
        assertThat(FailureAction.fromCode(99)).isEqualTo(FailureAction.STRIP_PARAMETERS);
    }

    @Test
    void requestType_onlyPostIsStateChanging() {
        assertThat(RequestType.fromMethod("POST")).isEqualTo(RequestType.POST);
        assertThat(RequestType.fromMethod("post")).isEqualTo(RequestType.POST);
        assertThat(RequestType.fromMethod("GET")).isEqualTo(RequestType.GET);
        assertThat(RequestType.fromMethod("HEAD")).isEqualTo(RequestType.GET);
    }
}
