package com.candor.core.seal;

import com.candor.core.domain.Principal;

import java.math.BigInteger;

/**
 * Sealing capability consumed by the case workflow.
 * Implementations decide the cryptography; callers only see handles and access lists.
 */
public interface SealingService {

    /**
     * Seals a value and returns its handle. Nobody can read it until granted.
     *
     * @throws IllegalArgumentException if the value does not fit the type
     */
    SealedHandle seal(SealedType type, BigInteger value);

    /**
     * Adds a principal to the handle's access list. Granting twice is a no-op.
     */
    void grantAccess(SealedHandle handle, Principal principal);

    boolean isAllowed(SealedHandle handle, Principal principal);

    /**
     * Reads a sealed value on behalf of a granted principal.
     *
     * @throws com.candor.core.exception.AuthorizationException if the reader was never granted
     */
    BigInteger unseal(SealedHandle handle, Principal reader);
}
