package com.gocomet.bustracking.common.exception;

public class NotAssignedException extends RuntimeException {
    public NotAssignedException(String driverId, String busId) {
        super(String.format("Driver %s is not assigned to bus %s", driverId, busId));
    }
}
