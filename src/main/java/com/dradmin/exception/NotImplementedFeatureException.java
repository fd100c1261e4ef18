package com.dradmin.exception;

public class NotImplementedFeatureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NotImplementedFeatureException(String feature) {
        super(feature + " is not implemented yet");
    }
}
