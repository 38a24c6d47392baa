package com.candor.core.exception;

/**
 * Base of every rejection raised by the case workflow. A rejected operation leaves no trace
 * in the case store.
 */
public abstract class CaseException extends RuntimeException {

    protected CaseException(String message) {
        super(message);
    }

    protected CaseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable code reported to API clients.
     */
    public abstract String code();
}
