package com.geotracking.engine.exception;

public class UnknownResourceException extends RuntimeException {

    public UnknownResourceException(String resourceType, String id) {
        super(String.format("%s '%s' not found", resourceType, id));
    }
}
