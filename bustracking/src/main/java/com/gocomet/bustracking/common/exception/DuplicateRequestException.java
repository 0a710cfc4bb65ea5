package com.gocomet.bustracking.common.exception;

import lombok.Getter;

/**
 * The caller already holds an active record of this kind. Carries the id of the
 * existing record so clients can show "you already have one" instead of "retry".
 */
@Getter
public class DuplicateRequestException extends RuntimeException {

    private final String existingId;

    public DuplicateRequestException(String message) {
        this(message, null);
    }

    public DuplicateRequestException(String message, String existingId) {
        super(message);
        this.existingId = existingId;
    }
}
