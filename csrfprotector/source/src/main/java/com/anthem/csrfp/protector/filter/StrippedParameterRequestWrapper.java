package com.anthem.csrfp.protector.filter;

import com.anthem.csrfp.core.model.RequestContext;
import com.anthem.csrfp.core.model.RequestType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;

import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hides the parameter set a failed validation stripped (the query string for
 * GET, form fields for POST) from everything downstream of the filter.
 */
public class StrippedParameterRequestWrapper extends HttpServletRequestWrapper {

    private final RequestType stripped;
    private final Map<String, String[]> parameters;

    public StrippedParameterRequestWrapper(HttpServletRequest request, RequestContext context, RequestType stripped) {
        super(request);
        this.stripped = stripped;
        this.parameters = remainingParameters(context);
    }

    @Override
    public String getParameter(String name) {
        String[] values = parameters.get(name);
        return values != null && values.length > 0 ? values[0] : null;
    }

    @Override
    public Map<String, String[]> getParameterMap() {
        return Collections.unmodifiableMap(parameters);
    }

    @Override
    public Enumeration<String> getParameterNames() {
        return Collections.enumeration(parameters.keySet());
    }

    @Override
    public String[] getParameterValues(String name) {
        String[] values = parameters.get(name);
        return values != null ? values.clone() : null;
    }

    @Override
    public String getQueryString() {
        return stripped == RequestType.GET ? null : super.getQueryString();
    }

    private static Map<String, String[]> remainingParameters(RequestContext context) {
        Map<String, String[]> merged = new LinkedHashMap<>();
        add(merged, context.getQueryParameters());
        add(merged, context.getBodyParameters());
        return merged;
    }

    private static void add(Map<String, String[]> target, Map<String, List<String>> source) {
        source.forEach((name, values) -> target.merge(name, values.toArray(new String[0]), (existing, extra) -> {
            String[] combined = new String[existing.length + extra.length];
            System.arraycopy(existing, 0, combined, 0, existing.length);
            System.arraycopy(extra, 0, combined, existing.length, extra.length);
            return combined;
        }));
    }
}
