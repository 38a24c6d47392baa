package com.candor.api.privacy;

import com.candor.core.domain.Principal;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces the public proxy for a report's severity.
 *
 * The multiplier is keccak-256 over an internal counter, the submission count, the caller
 * and the current time, reduced to [1, 1000]. It is a heuristic mask, not a cryptographic
 * commitment: anyone who knows the inputs can recompute it.
 */
@Component
public class SeverityObfuscator {

    public static final int MAX_MULTIPLIER = 1000;
    private static final BigInteger MODULUS = BigInteger.valueOf(MAX_MULTIPLIER);

    private final AtomicLong nonce = new AtomicLong();
    private final Clock clock;

    public SeverityObfuscator(Clock clock) {
        this.clock = clock;
    }

    public int generateMultiplier(long submissionCount, Principal caller) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        byte[] callerBytes = Numeric.toBytesPadded(caller.toBigInteger(), 20);
        ByteBuffer seed = ByteBuffer.allocate(8 + 8 + 20 + 8)
                .putLong(nonce.incrementAndGet())
                .putLong(submissionCount)
                .put(callerBytes)
                .putLong(clock.millis());
        BigInteger digest = new BigInteger(1, Hash.sha3(seed.array()));
        return digest.mod(MODULUS).intValue() + 1;
    }

    public int obfuscate(int severity, int multiplier) {
        if (multiplier < 1 || multiplier > MAX_MULTIPLIER) {
            throw new IllegalArgumentException("Multiplier out of range: " + multiplier);
        }
        return (severity * multiplier) % MAX_MULTIPLIER;
    }

    public int obfuscate(int severity, long submissionCount, Principal caller) {
        return obfuscate(severity, generateMultiplier(submissionCount, caller));
    }
}
