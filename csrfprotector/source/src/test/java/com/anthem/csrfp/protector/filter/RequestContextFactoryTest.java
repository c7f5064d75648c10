package com.anthem.csrfp.protector.filter;

import com.anthem.csrfp.core.model.RequestContext;
import com.anthem.csrfp.core.model.RequestType;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestContextFactoryTest {

    @Test
    void from_postWithQueryString_separatesQueryFromBody() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/orders");
        request.setQueryString("page=2");
        request.addParameter("page", "2");
        request.addParameter("item", "book");
        request.addParameter("CSRFPROTECTOR_AUTH_TOKEN", "abc");

        RequestContext context = RequestContextFactory.from(request);

        assertThat(context.getRequestType()).isEqualTo(RequestType.POST);
        assertThat(context.getQueryParameters()).containsExactly(Map.entry("page", List.of("2")));
        assertThat(context.getBodyParameters()).containsOnlyKeys("item", "CSRFPROTECTOR_AUTH_TOKEN");
        assertThat(context.getSubmittedToken()).isEqualTo("abc");
        assertThat(context.getRequestUri()).isEqualTo("/orders?page=2");
    }

    @Test
    void from_sameNameInQueryAndBody_keepsBodyOccurrence() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/orders");
        request.setQueryString("tag=a");
        request.addParameter("tag", "a", "b");

        RequestContext context = RequestContextFactory.from(request);

        assertThat(context.getQueryParameters().get("tag")).containsExactly("a");
        assertThat(context.getBodyParameters().get("tag")).containsExactly("b");
    }

    @Test
    void from_getRequest_readsTokenFromQuery() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/search");
        request.setQueryString("CSRFPROTECTOR_AUTH_TOKEN=xyz&q=red+shoes");
        request.addParameter("CSRFPROTECTOR_AUTH_TOKEN", "xyz");
        request.addParameter("q", "red shoes");

        RequestContext context = RequestContextFactory.from(request);

        assertThat(context.getRequestType()).isEqualTo(RequestType.GET);
        assertThat(context.getSubmittedToken()).isEqualTo("xyz");
        assertThat(context.getBodyParameters()).isEmpty();
    }

    @Test
    void from_hostAndCookies_areCopied() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.addHeader("Host", "shop.example.org");
        request.setCookies(new Cookie("CSRF_AUTH_TOKEN", "t1"), new Cookie("session", "s1"));

        RequestContext context = RequestContextFactory.from(request);

        assertThat(context.getHost()).isEqualTo("shop.example.org");
        assertThat(context.getCookies()).containsEntry("CSRF_AUTH_TOKEN", "t1").containsEntry("session", "s1");
    }

    @Test
    void from_noHostHeader_fallsBackToServerName() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.setServerName("internal.local");

        assertThat(RequestContextFactory.from(request).getHost()).isEqualTo("internal.local");
    }

    @Test
    void queryParameters_decodesNamesAndValues() {
        Map<String, List<String>> parameters = RequestContextFactory.queryParameters("na%20me=a%26b&empty&x=1&x=2");

        assertThat(parameters.get("na me")).containsExactly("a&b");
        assertThat(parameters.get("empty")).containsExactly("");
        assertThat(parameters.get("x")).containsExactly("1", "2");
    }

    @Test
    void queryParameters_brokenEscape_skipsOnlyThatPair() {
        Map<String, List<String>> parameters = RequestContextFactory.queryParameters("q=100%&page=2&bad%zz=1&x=%4");

        assertThat(parameters).containsOnlyKeys("page");
        assertThat(parameters.get("page")).containsExactly("2");
    }

    @Test
    void from_getWithBrokenEscape_buildsContext() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/search");
        request.setQueryString("q=100%");

        RequestContext context = RequestContextFactory.from(request);

        assertThat(context.getQueryParameters()).isEmpty();
        assertThat(context.getRequestUri()).isEqualTo("/search?q=100%");
    }

    @Test
    void queryParameters_blank_isEmpty() {
        assertThat(RequestContextFactory.queryParameters(null)).isEmpty();
        assertThat(RequestContextFactory.queryParameters("")).isEmpty();
    }
}
