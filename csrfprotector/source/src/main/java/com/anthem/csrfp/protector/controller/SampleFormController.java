package com.anthem.csrfp.protector.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.util.concurrent.Callable;

/**
 * Minimal protected page for smoke-testing a deployment.
 * GET / renders a form, GET /deferred renders the same form from an async
 * handler, and POST /submit only reaches here with a valid token.
 */
@RestController
@Slf4j
public class SampleFormController {

    private static final String FORM_PAGE = """
            <!DOCTYPE html>
            <html>
            <head><title>CSRF Protector</title></head>
            <body>
            <form method="post" action="/submit">
              <input type="text" name="comment">
              <button type="submit">Send</button>
            </form>
            </body>
            </html>
            """;

    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE + ";charset=UTF-8")
    public String form() {
        return FORM_PAGE;
    }

    @GetMapping(value = "/deferred", produces = MediaType.TEXT_HTML_VALUE + ";charset=UTF-8")
    public Callable<String> deferredForm() {
        return () -> FORM_PAGE;
    }

    @PostMapping(value = "/submit", produces = MediaType.TEXT_HTML_VALUE + ";charset=UTF-8")
    public String submit(@RequestParam(value = "comment", required = false) String comment) {
        log.info("Form submitted: hasComment={}", comment != null);
        String shown = comment != null ? HtmlUtils.htmlEscape(comment) : "(none)";
        return "<!DOCTYPE html>\n<html>\n<head><title>Submitted</title></head>\n<body>\n<p>Received: "
                + shown + "</p>\n</body>\n</html>\n";
    }
}
