package com.xendex.backend.exceptions;

/**
 * An operation that the current state of a sequence rules out, such as deleting it while active
 * or requesting a touch beyond its limit.
 */
public class SequenceConflictException extends RuntimeException {

    private final String code;

    public SequenceConflictException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
