package com.candor.core.seal;

/**
 * The oracle's answer: ABI-encoded clear values and a proof over (requestId, clearValues).
 */
public record DecryptionResponse(long requestId, byte[] clearValues, byte[] proof) {
}
