package com.candor.core.seal;

import java.util.List;

/**
 * Transport to the external decryption oracle.
 */
public interface DecryptionGateway {

    /**
     * Dispatches one decryption request for the given handles and returns at once.
     * The response future completes whenever the oracle answers, possibly never.
     */
    PendingDecryption requestReveal(List<SealedHandle> handles);
}
