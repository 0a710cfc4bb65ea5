package com.gocomet.bustracking.common.exception;

/**
 * Soft "slow down" condition. Not an application failure.
 */
public class ThrottledException extends RuntimeException {
    public ThrottledException(String message) {
        super(message);
    }
}
