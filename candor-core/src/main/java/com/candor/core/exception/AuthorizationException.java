package com.candor.core.exception;

/**
 * Wrong role or caller for the operation.
 */
public class AuthorizationException extends CaseException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "CASE_403";
    }
}
