package com.anthem.csrfp.protector.filter;

import com.anthem.csrfp.core.model.RequestContext;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the protector's view of a servlet request.
 *
 * The servlet API merges query and form parameters; they are separated again
 * here by parsing the query string and treating whatever is left as body.
 */
@Slf4j
public final class RequestContextFactory {

    private RequestContextFactory() {
    }

    public static RequestContext from(HttpServletRequest request) {
        Map<String, List<String>> query = queryParameters(request.getQueryString());
        return RequestContext.builder()
                .method(request.getMethod())
                .host(host(request))
                .requestUri(requestUri(request))
                .queryParameters(query)
                .bodyParameters(bodyParameters(request, query))
                .cookies(cookies(request))
                .build();
    }

    static Map<String, List<String>> queryParameters(String queryString) {
        Map<String, List<String>> parameters = new LinkedHashMap<>();
        if (queryString == null || queryString.isEmpty()) {
            return parameters;
        }
        MultiValueMap<String, String> raw = UriComponentsBuilder.newInstance()
                .query(queryString)
                .build()
                .getQueryParams();
        raw.forEach((name, values) -> {
            String decodedName = decode(name);
            if (decodedName == null) {
                log.debug("Skipping query parameter with malformed name: {}", name);
                return;
            }
            for (String value : values) {
                String decoded = value != null ? decode(value) : "";
                if (decoded == null) {
                    log.debug("Skipping malformed value of query parameter {}", decodedName);
                    continue;
                }
                parameters.computeIfAbsent(decodedName, key -> new ArrayList<>()).add(decoded);
            }
        });
        return parameters;
    }

    private static Map<String, List<String>> bodyParameters(
            HttpServletRequest request, Map<String, List<String>> query) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        request.getParameterMap().forEach((name, values) -> {
            List<String> remaining = new ArrayList<>(List.of(values));
            // one occurrence per query value
            for (String fromQuery : query.getOrDefault(name, List.of())) {
                remaining.remove(fromQuery);
            }
            if (!remaining.isEmpty()) {
                body.put(name, remaining);
            }
        });
        return body;
    }

    private static Map<String, String> cookies(HttpServletRequest request) {
        Map<String, String> cookies = new LinkedHashMap<>();
        Cookie[] sent = request.getCookies();
        if (sent != null) {
            for (Cookie cookie : sent) {
                cookies.put(cookie.getName(), cookie.getValue());
            }
        }
        return cookies;
    }

    private static String host(HttpServletRequest request) {
        String host = request.getHeader(HttpHeaders.HOST);
        return host != null ? host : request.getServerName();
    }

    private static String requestUri(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return queryString != null ? request.getRequestURI() + "?" + queryString : request.getRequestURI();
    }

    /**
     * Percent-decode, or {@code null} for a broken escape. The servlet
     * container skips such pairs when it builds the parameter map, so they
     * are skipped here as well.
     */
    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
