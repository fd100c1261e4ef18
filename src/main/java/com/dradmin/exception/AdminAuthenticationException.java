package com.dradmin.exception;

public class AdminAuthenticationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AdminAuthenticationException(String message) {
        super(message);
    }

    public AdminAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
