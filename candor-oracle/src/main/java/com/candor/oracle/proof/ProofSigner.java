package com.candor.oracle.proof;

import com.candor.core.domain.Principal;
import com.candor.oracle.OracleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.security.GeneralSecurityException;

/**
 * Signs oracle responses with the local oracle's key.
 */
@Service
public class ProofSigner {

    private static final Logger log = LoggerFactory.getLogger(ProofSigner.class);

    private final Credentials credentials;

    public ProofSigner(OracleConfig config) {
        this.credentials = loadCredentials(config.getSignerPrivateKey());
        log.info("Oracle signer address {}", credentials.getAddress());
    }

    public byte[] sign(long requestId, byte[] clearValues) {
        byte[] digest = OracleProofs.digest(requestId, clearValues);
        Sign.SignatureData signature = Sign.signMessage(digest, credentials.getEcKeyPair(), false);

        byte[] proof = new byte[OracleProofs.SIGNATURE_LENGTH];
        System.arraycopy(signature.getR(), 0, proof, 0, 32);
        System.arraycopy(signature.getS(), 0, proof, 32, 32);
        proof[64] = signature.getV()[0];
        return proof;
    }

    public Principal address() {
        return Principal.of(credentials.getAddress());
    }

    private static Credentials loadCredentials(String privateKey) {
        if (privateKey != null && !privateKey.isBlank()) {
            return Credentials.create(privateKey);
        }
        log.warn("No oracle signer key configured; generated an ephemeral key");
        try {
            return Credentials.create(Keys.createEcKeyPair());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate oracle signer key", e);
        }
    }
}
