package com.candor.core.exception;

/**
 * Refund claimed before its deadline.
 */
public class TimeoutNotReachedException extends CaseException {

    public TimeoutNotReachedException(String message) {
        super(message);
    }

    public TimeoutNotReachedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "CASE_425";
    }
}
