package com.candor.core.seal;

import java.util.concurrent.CompletableFuture;

/**
 * A dispatched decryption request, keyed by the oracle-assigned request id.
 */
public record PendingDecryption(long requestId, CompletableFuture<DecryptionResponse> response) {
}
