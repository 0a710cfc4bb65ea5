package com.gocomet.bustracking.common.exception;

public class LocationRejectedException extends RuntimeException {
    public LocationRejectedException(String message) {
        super(message);
    }
}
