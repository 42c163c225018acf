package com.chronofill.backend.exception;

public class IllegalStateTransitionException extends ConflictException {

    public IllegalStateTransitionException(String entity, Object id, Enum<?> from, Enum<?> to) {
        super(entity + " " + id + " cannot move from " + from + " to " + to);
    }
}
