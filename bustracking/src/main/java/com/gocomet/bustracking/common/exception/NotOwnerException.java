package com.gocomet.bustracking.common.exception;

public class NotOwnerException extends RuntimeException {
    public NotOwnerException(String entity, Object id) {
        super(String.format("Caller does not own %s %s", entity, id));
    }
}
