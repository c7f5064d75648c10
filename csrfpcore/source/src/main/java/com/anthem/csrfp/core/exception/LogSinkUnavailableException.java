package com.anthem.csrfp.core.exception;

/**
 * The attack log could not be written while handling a denied request.
 */
public class LogSinkUnavailableException extends CsrfpException {

    public LogSinkUnavailableException(String message) {
        super(message);
    }

    public LogSinkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
