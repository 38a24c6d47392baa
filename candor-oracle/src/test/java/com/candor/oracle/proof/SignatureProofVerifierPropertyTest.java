package com.candor.oracle.proof;

import com.candor.oracle.OracleConfig;
import net.jqwik.api.*;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.security.GeneralSecurityException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for oracle proof signing and verification.
 */
class SignatureProofVerifierPropertyTest {

    // ==================== Single signer ====================

    @Property(tries = 30)
    void localSignatureVerifies(
            @ForAll @LongRange(min = 1, max = 1_000_000) long requestId,
            @ForAll @Size(min = 32, max = 96) byte[] clearValues) {
        ProofSigner signer = new ProofSigner(new OracleConfig());
        SignatureProofVerifier verifier = new SignatureProofVerifier(new OracleConfig(), signer);

        byte[] proof = signer.sign(requestId, clearValues);

        assertThat(proof).hasSize(OracleProofs.SIGNATURE_LENGTH);
        assertThat(verifier.verify(requestId, clearValues, proof)).isTrue();
    }

    @Property(tries = 30)
    void tamperedClearValuesFail(
            @ForAll @LongRange(min = 1, max = 1_000_000) long requestId,
            @ForAll @Size(min = 32, max = 96) byte[] clearValues) {
        ProofSigner signer = new ProofSigner(new OracleConfig());
        SignatureProofVerifier verifier = new SignatureProofVerifier(new OracleConfig(), signer);
        byte[] proof = signer.sign(requestId, clearValues);

        byte[] tampered = clearValues.clone();
        tampered[tampered.length - 1] ^= 0x01;

        assertThat(verifier.verify(requestId, tampered, proof)).isFalse();
    }

    @Property(tries = 30)
    void proofIsBoundToRequestId(@ForAll @LongRange(min = 1, max = 1_000_000) long requestId) {
        ProofSigner signer = new ProofSigner(new OracleConfig());
        SignatureProofVerifier verifier = new SignatureProofVerifier(new OracleConfig(), signer);
        byte[] clearValues = new byte[96];

        byte[] proof = signer.sign(requestId, clearValues);

        assertThat(verifier.verify(requestId + 1, clearValues, proof)).isFalse();
    }

    // ==================== Trusted signer set ====================

    @Test
    void untrustedSignerFails() throws GeneralSecurityException {
        ProofSigner trusted = signer();
        ProofSigner rogue = signer();
        SignatureProofVerifier verifier = new SignatureProofVerifier(new OracleConfig(), trusted);

        byte[] clearValues = new byte[96];

        assertThat(verifier.verify(7, clearValues, rogue.sign(7, clearValues))).isFalse();
        assertThat(verifier.trustedSigners()).containsExactly(trusted.address());
    }

    @Test
    void thresholdCountsDistinctTrustedSigners() throws GeneralSecurityException {
        ProofSigner first = signer();
        ProofSigner second = signer();
        ProofSigner third = signer();

        OracleConfig config = new OracleConfig();
        config.setTrustedSigners(List.of(
                first.address().address(), second.address().address(), third.address().address()));
        config.setSignatureThreshold(2);
        SignatureProofVerifier verifier = new SignatureProofVerifier(config, first);

        byte[] clearValues = new byte[96];
        byte[] one = first.sign(3, clearValues);
        byte[] two = second.sign(3, clearValues);

        assertThat(verifier.verify(3, clearValues, one)).isFalse();
        assertThat(verifier.verify(3, clearValues, concat(one, one))).isFalse();
        assertThat(verifier.verify(3, clearValues, concat(one, two))).isTrue();
    }

    @Test
    void malformedProofFails() {
        ProofSigner signer = new ProofSigner(new OracleConfig());
        SignatureProofVerifier verifier = new SignatureProofVerifier(new OracleConfig(), signer);
        byte[] clearValues = new byte[32];

        assertThat(verifier.verify(1, clearValues, new byte[0])).isFalse();
        assertThat(verifier.verify(1, clearValues, new byte[64])).isFalse();
        assertThat(verifier.verify(1, clearValues, new byte[65])).isFalse();
        assertThat(verifier.verify(1, clearValues, null)).isFalse();
    }

    @Test
    void thresholdAboveSignerCountIsRejected() {
        OracleConfig config = new OracleConfig();
        config.setSignatureThreshold(2);

        assertThatThrownBy(() -> new SignatureProofVerifier(config, new ProofSigner(new OracleConfig())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void configuredKeyGivesStableAddress() {
        OracleConfig config = new OracleConfig();
        config.setSignerPrivateKey("0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318");

        assertThat(new ProofSigner(config).address())
                .isEqualTo(new ProofSigner(config).address());
    }

    private static ProofSigner signer() throws GeneralSecurityException {
        OracleConfig config = new OracleConfig();
        config.setSignerPrivateKey(Numeric.toHexStringWithPrefix(Keys.createEcKeyPair().getPrivateKey()));
        return new ProofSigner(config);
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] result = new byte[a.length + b.length];
        System.arraycopy(a, 0, result, 0, a.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }
}
