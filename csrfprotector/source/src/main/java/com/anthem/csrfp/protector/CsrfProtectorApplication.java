package com.anthem.csrfp.protector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Web front for the CSRF protector.
 *
 * Every request passes through {@link com.anthem.csrfp.protector.filter.CsrfProtectionFilter}:
 * POST (and, when enabled, GET) requests must echo the token cookie in the
 * CSRFPROTECTOR_AUTH_TOKEN field; HTML responses get the client script that
 * fills that field in.
 */
@SpringBootApplication
public class CsrfProtectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CsrfProtectorApplication.class, args);
    }
}
