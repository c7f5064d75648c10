package com.anthem.csrfp.core.service;

import java.time.Duration;

/**
 * Access to the client's token cookie, implemented by the host over its transport.
 */
public interface CookieStore {

    /**
     * Token the client sent back, or null if it sent none.
     */
    String getToken();

    /**
     * Issue {@code token} to the client, valid for {@code maxAge} from now.
     */
    void setToken(String token, Duration maxAge);
}
