package com.xendex.backend.exceptions;

/**
 * Transient failure of an outside collaborator (content generation, email transport).
 * Thrown from background tasks so the task scheduler retries with backoff.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
