package com.candor.oracle.proof;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * Proof layout shared by signer and verifier.
 *
 * A proof is a run of 65-byte secp256k1 signatures (r, s, v) over
 * {@code keccak256(uint256(requestId) || clearValues)}.
 */
public final class OracleProofs {

    public static final int SIGNATURE_LENGTH = 65;

    private OracleProofs() {}

    public static byte[] digest(long requestId, byte[] clearValues) {
        byte[] id = Numeric.toBytesPadded(BigInteger.valueOf(requestId), 32);
        byte[] message = new byte[id.length + clearValues.length];
        System.arraycopy(id, 0, message, 0, id.length);
        System.arraycopy(clearValues, 0, message, id.length, clearValues.length);
        return Hash.sha3(message);
    }
}
