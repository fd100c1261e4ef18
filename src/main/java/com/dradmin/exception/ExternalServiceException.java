package com.dradmin.exception;

/**
 * Failure reported by a remote system: Stripe, a hosting control panel,
 * a registrar API or the exchange-rate provider.
 */
public class ExternalServiceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
