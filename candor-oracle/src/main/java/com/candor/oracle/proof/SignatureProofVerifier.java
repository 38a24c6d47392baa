package com.candor.oracle.proof;

import com.candor.core.domain.Principal;
import com.candor.core.seal.ProofVerifier;
import com.candor.oracle.OracleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Accepts a proof when at least {@code signatureThreshold} distinct trusted signers
 * signed the response digest. With no trusted signers configured, the local oracle
 * signer is the only one trusted.
 */
@Service
public class SignatureProofVerifier implements ProofVerifier {

    private static final Logger log = LoggerFactory.getLogger(SignatureProofVerifier.class);

    private final Set<Principal> trustedSigners;
    private final int threshold;

    public SignatureProofVerifier(OracleConfig config, ProofSigner localSigner) {
        this.trustedSigners = config.getTrustedSigners().isEmpty()
                ? Set.of(localSigner.address())
                : config.getTrustedSigners().stream().map(Principal::of).collect(Collectors.toUnmodifiableSet());
        if (config.getSignatureThreshold() < 1 || config.getSignatureThreshold() > trustedSigners.size()) {
            throw new IllegalArgumentException("Signature threshold must be between 1 and " + trustedSigners.size());
        }
        this.threshold = config.getSignatureThreshold();
    }

    @Override
    public boolean verify(long requestId, byte[] clearValues, byte[] proof) {
        if (clearValues == null || proof == null || proof.length == 0
                || proof.length % OracleProofs.SIGNATURE_LENGTH != 0) {
            return false;
        }
        byte[] digest = OracleProofs.digest(requestId, clearValues);

        Set<Principal> signers = new HashSet<>();
        for (int offset = 0; offset < proof.length; offset += OracleProofs.SIGNATURE_LENGTH) {
            byte[] chunk = Arrays.copyOfRange(proof, offset, offset + OracleProofs.SIGNATURE_LENGTH);
            recoverSigner(digest, chunk)
                    .filter(trustedSigners::contains)
                    .ifPresent(signers::add);
        }
        return signers.size() >= threshold;
    }

    public Set<Principal> trustedSigners() {
        return trustedSigners;
    }

    private Optional<Principal> recoverSigner(byte[] digest, byte[] signature) {
        Sign.SignatureData data = new Sign.SignatureData(
                signature[64],
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64));
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(digest, data);
            return Optional.of(Principal.of("0x" + Keys.getAddress(publicKey)));
        } catch (SignatureException | RuntimeException e) {
            log.debug("Unrecoverable signature in oracle proof: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
