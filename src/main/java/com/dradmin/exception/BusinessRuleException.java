package com.dradmin.exception;

/**
 * Raised when a request is well-formed but conflicts with the current state of the data,
 * e.g. issuing an invoice that has no lines or deducting more credit than is available.
 */
public class BusinessRuleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BusinessRuleException(String message) {
        super(message);
    }
}
