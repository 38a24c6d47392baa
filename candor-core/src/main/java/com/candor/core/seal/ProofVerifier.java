package com.candor.core.seal;

/**
 * Decides whether an oracle response is authentic.
 */
@FunctionalInterface
public interface ProofVerifier {

    /**
     * @return true only if {@code proof} attests {@code clearValues} as the answer to {@code requestId}
     */
    boolean verify(long requestId, byte[] clearValues, byte[] proof);
}
