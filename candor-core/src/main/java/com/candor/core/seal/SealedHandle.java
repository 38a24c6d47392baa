package com.candor.core.seal;

import java.util.Objects;

/**
 * Opaque reference to a sealed value. Holding a handle grants nothing; reads go through
 * {@link SealingService#unseal} and its access list.
 */
public record SealedHandle(String id, SealedType type) {

    public SealedHandle {
        Objects.requireNonNull(id, "Handle id cannot be null");
        Objects.requireNonNull(type, "Handle type cannot be null");
    }
}
