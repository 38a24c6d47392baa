package com.candor.core.exception;

/**
 * Oracle proof did not verify; the callback is discarded.
 */
public class ProofVerificationException extends CaseException {

    public ProofVerificationException(String message) {
        super(message);
    }

    public ProofVerificationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "CASE_422";
    }
}
