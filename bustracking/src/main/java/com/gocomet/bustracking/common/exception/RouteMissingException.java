package com.gocomet.bustracking.common.exception;

public class RouteMissingException extends RuntimeException {
    public RouteMissingException(String busId) {
        super(String.format("Bus %s has no associated route", busId));
    }
}
