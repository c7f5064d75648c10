package com.anthem.csrfp.core.service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Injects the no-script notice and the client script include into an
 * outgoing HTML response. One instance per response.
 *
 * <p>Output is passed through untouched until an {@code <html} tag has been
 * seen. After that the notice goes right after the first {@code <body>} tag
 * and the script right before the first {@code </body>}; when the body is
 * never closed the script is appended to the last chunk. Each is injected at
 * most once per response, and never into a buffer that already carries it,
 * so feeding the rewriter its own output is harmless.
 *
 * <p>When a streamed chunk ends inside one of the tags above, that unfinished
 * tag is held back and emitted at the front of the next chunk.
 */
public class HtmlRewriter {

    private static final Pattern HTML_OPEN = Pattern.compile("<html", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_OPEN = Pattern.compile("<body(?:\\s[^>]*)?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_CLOSE = Pattern.compile("</body>", Pattern.CASE_INSENSITIVE);

    private static final List<String> WATCHED_TAGS = List.of("<html", "<body", "</body>");

    // Longer unfinished tails are released as-is.
    private static final int MAX_HELD_LENGTH = 1024;

    private final String noscriptBlock;
    private final String scriptTag;

    private boolean validHtml;
    private boolean noscriptInjected;
    private boolean scriptInjected;
    private String held = "";

    public HtmlRewriter(String jsResourceUrl, String disabledJsMessage) {
        this.noscriptBlock = "<noscript>" + (disabledJsMessage != null ? disabledJsMessage : "") + "</noscript>";
        this.scriptTag = "<script type=\"text/javascript\" src=\"" + jsResourceUrl + "\"></script>";
    }

    /**
     * Rewrite a complete response body.
     */
    public String rewrite(String buffer) {
        return rewrite(buffer, true);
    }

    /**
     * Rewrite one chunk of a streamed body.
     *
     * @param last whether this is the final chunk; the append-at-end fallback only applies to it
     */
    public String rewrite(String chunk, boolean last) {
        if (chunk == null) {
            return null;
        }
        String buffer = held.isEmpty() ? chunk : held + chunk;
        held = "";
        if (!last && !(noscriptInjected && scriptInjected)) {
            int split = unfinishedTagStart(buffer);
            held = buffer.substring(split);
            buffer = buffer.substring(0, split);
        }
        if (!validHtml && !detectHtml(buffer)) {
            return buffer;
        }

        String out = buffer;
        if (!noscriptInjected) {
            out = injectNoscript(out);
        }
        if (!scriptInjected) {
            out = injectScript(out, last);
        }
        return out;
    }

    public boolean isValidHtml() {
        return validHtml;
    }

    private boolean detectHtml(String buffer) {
        if (HTML_OPEN.matcher(buffer).find()) {
            validHtml = true;
        }
        return validHtml;
    }

    /**
     * Index where a trailing, not yet closed watched tag begins, or the buffer
     * length when there is none.
     */
    static int unfinishedTagStart(String buffer) {
        int start = buffer.lastIndexOf('<');
        if (start < 0 || buffer.indexOf('>', start) >= 0 || buffer.length() - start > MAX_HELD_LENGTH) {
            return buffer.length();
        }
        String tail = buffer.substring(start).toLowerCase(Locale.ROOT);
        for (String tag : WATCHED_TAGS) {
            if (tag.startsWith(tail) || tail.startsWith(tag)) {
                return start;
            }
        }
        return buffer.length();
    }

    private String injectNoscript(String buffer) {
        if (buffer.contains(noscriptBlock)) {
            noscriptInjected = true;
            return buffer;
        }
        Matcher matcher = BODY_OPEN.matcher(buffer);
        if (!matcher.find()) {
            return buffer;
        }
        noscriptInjected = true;
        return buffer.substring(0, matcher.end()) + noscriptBlock + buffer.substring(matcher.end());
    }

    private String injectScript(String buffer, boolean last) {
        if (buffer.contains(scriptTag)) {
            scriptInjected = true;
            return buffer;
        }
        Matcher matcher = BODY_CLOSE.matcher(buffer);
        if (matcher.find()) {
            scriptInjected = true;
            return buffer.substring(0, matcher.start()) + scriptTag + buffer.substring(matcher.start());
        }
        if (last) {
            scriptInjected = true;
            return buffer + scriptTag;
        }
        return buffer;
    }
}
