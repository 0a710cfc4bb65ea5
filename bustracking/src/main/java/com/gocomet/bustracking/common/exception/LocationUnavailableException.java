package com.gocomet.bustracking.common.exception;

public class LocationUnavailableException extends RuntimeException {
    public LocationUnavailableException(String message) {
        super(message);
    }
}
