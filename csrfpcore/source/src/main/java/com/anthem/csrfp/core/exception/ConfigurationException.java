package com.anthem.csrfp.core.exception;

/**
 * Configuration is missing or unusable. Raised at startup; no request
 * may be served by a protector that failed with this.
 */
public class ConfigurationException extends CsrfpException {

    public ConfigurationException(String message) {
        super(message);
    }
}
