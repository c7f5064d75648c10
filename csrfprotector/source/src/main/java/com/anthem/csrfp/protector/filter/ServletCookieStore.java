package com.anthem.csrfp.protector.filter;

import com.anthem.csrfp.core.CsrfpConstants;
import com.anthem.csrfp.core.service.CookieStore;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.time.Duration;

/**
 * Token cookie over the servlet request/response pair.
 * The cookie stays readable from JavaScript: the client script copies it into forms.
 */
public class ServletCookieStore implements CookieStore {

    private final HttpServletRequest request;
    private final HttpServletResponse response;

    public ServletCookieStore(HttpServletRequest request, HttpServletResponse response) {
        this.request = request;
        this.response = response;
    }

    @Override
    public String getToken() {
        Cookie cookie = WebUtils.getCookie(request, CsrfpConstants.TOKEN_COOKIE_NAME);
        return cookie != null ? cookie.getValue() : null;
    }

    @Override
    public void setToken(String token, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(CsrfpConstants.TOKEN_COOKIE_NAME, token)
                .path("/")
                .maxAge(maxAge)
                .sameSite("Lax")
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
