package com.anthem.csrfp.protector.filter;

import com.anthem.csrfp.core.CsrfProtector;
import com.anthem.csrfp.core.exception.LogSinkUnavailableException;
import com.anthem.csrfp.core.model.ActionOutcome;
import com.anthem.csrfp.core.model.AuthorizationResult;
import com.anthem.csrfp.core.model.RequestContext;
import com.anthem.csrfp.core.service.HtmlRewriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;
import org.springframework.web.util.WebUtils;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Runs every request through the protector before the application sees it,
 * and the HTML it produces through the rewriter before the client sees it.
 */
@Slf4j
public class CsrfProtectionFilter extends OncePerRequestFilter {

    private final CsrfProtector csrfProtector;

    public CsrfProtectionFilter(CsrfProtector csrfProtector) {
        this.csrfProtector = csrfProtector;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (isAsyncDispatch(request)) {
            // Already authorized on the initial dispatch; only the buffered body is left to finish.
            filterChain.doFilter(request, response);
            ContentCachingResponseWrapper cachingResponse =
                    WebUtils.getNativeResponse(response, ContentCachingResponseWrapper.class);
            if (cachingResponse != null && !isAsyncStarted(request)) {
                writeBody(request, cachingResponse, csrfProtector.newRewriter());
            }
            return;
        }

        RequestContext context = RequestContextFactory.from(request);
        AuthorizationResult result;
        try {
            result = csrfProtector.authorize(context, new ServletCookieStore(request, response));
        } catch (LogSinkUnavailableException e) {
            log.error("Attack log unavailable, aborting request: method={}, uri={}",
                    request.getMethod(), request.getRequestURI(), e);
            throw e;
        }

        ActionOutcome outcome = result.getOutcome();
        if (outcome.isTerminal()) {
            sendOutcome(response, outcome);
            return;
        }

        HttpServletRequest downstream = outcome.isParametersStripped()
                ? new StrippedParameterRequestWrapper(request, context, outcome.getStrippedParameters())
                : request;

        ContentCachingResponseWrapper cachingResponse = new ContentCachingResponseWrapper(response);
        filterChain.doFilter(downstream, cachingResponse);
        if (isAsyncStarted(downstream)) {
            log.debug("Async processing started, deferring body rewrite: uri={}", request.getRequestURI());
            return;
        }
        writeBody(request, cachingResponse, csrfProtector.newRewriter());
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    private void sendOutcome(HttpServletResponse response, ActionOutcome outcome) throws IOException {
        if (outcome.getKind() == ActionOutcome.Kind.REDIRECT) {
            response.sendRedirect(outcome.getLocation());
            return;
        }
        response.setStatus(outcome.getStatus());
        response.setContentType(MediaType.TEXT_HTML_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(outcome.getBody() != null ? outcome.getBody() : "");
        response.flushBuffer();
    }

    private void writeBody(HttpServletRequest request, ContentCachingResponseWrapper response, HtmlRewriter rewriter)
            throws IOException {
        if (response.getContentSize() == 0 || !isHtml(response.getContentType())) {
            response.copyBodyToResponse();
            return;
        }

        Charset charset = Charset.forName(response.getCharacterEncoding());
        String body = new String(response.getContentAsByteArray(), charset);
        String rewritten = rewriter.rewrite(body);
        if (!rewritten.equals(body)) {
            response.resetBuffer();
            response.getOutputStream().write(rewritten.getBytes(charset));
            log.debug("Injected CSRF script into response: uri={}", request.getRequestURI());
        }
        response.copyBodyToResponse();
    }

    static boolean isHtml(String contentType) {
        if (contentType == null) {
            return false;
        }
        try {
            MediaType mediaType = MediaType.parseMediaType(contentType);
            return MediaType.TEXT_HTML.isCompatibleWith(mediaType)
                    || MediaType.APPLICATION_XHTML_XML.isCompatibleWith(mediaType);
        } catch (InvalidMediaTypeException e) {
            log.debug("Unparseable content type, not rewriting: {}", contentType);
            return false;
        }
    }
}
