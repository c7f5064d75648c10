package com.anthem.csrfp.core.exception;

/**
 * Base class for faults raised by the protector itself.
 * A failed token check is not one of them; see {@code AuthorizationResult}.
 */
public class CsrfpException extends RuntimeException {

    public CsrfpException(String message) {
        super(message);
    }

    public CsrfpException(String message, Throwable cause) {
        super(message, cause);
    }
}
