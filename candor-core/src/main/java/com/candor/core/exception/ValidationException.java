package com.candor.core.exception;

/**
 * Out-of-range input, unknown id or null address.
 */
public class ValidationException extends CaseException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "CASE_400";
    }
}
