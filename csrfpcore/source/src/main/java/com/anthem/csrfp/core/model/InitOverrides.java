package com.anthem.csrfp.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Call-site overrides applied over the loaded configuration before the
 * protector is built. A null field leaves the configured value alone.
 */
@Value
@Builder
public class InitOverrides {

    public static final InitOverrides NONE = InitOverrides.builder().build();

    /** Only {@code TRUE} has an effect: it switches GET protection on. */
    Boolean getEnabled;

    Integer tokenLength;

    /** Replaces both the GET and the POST failure action codes. */
    Integer action;
}
