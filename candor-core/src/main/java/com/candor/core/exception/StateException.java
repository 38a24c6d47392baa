package com.candor.core.exception;

/**
 * Operation not valid for the report's current status.
 */
public class StateException extends CaseException {

    public StateException(String message) {
        super(message);
    }

    public StateException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "CASE_409";
    }
}
