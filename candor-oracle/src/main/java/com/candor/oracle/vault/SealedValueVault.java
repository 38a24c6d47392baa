package com.candor.oracle.vault;

import com.candor.core.domain.Principal;
import com.candor.core.exception.AuthorizationException;
import com.candor.core.seal.SealedHandle;
import com.candor.core.seal.SealedType;
import com.candor.core.seal.SealingService;
import com.candor.oracle.OracleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Envelope-encrypting vault backing {@link SealingService}.
 *
 * Each sealed value gets its own AES-256 data key, wrapped by the vault master key.
 * Values are readable only by principals on the handle's access list, or by the
 * oracle through {@link #decryptForOracle}.
 */
@Service
public class SealedValueVault implements SealingService {

    private static final Logger log = LoggerFactory.getLogger(SealedValueVault.class);

    private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128;
    private static final int GCM_IV_LENGTH = 12;
    private static final int KEY_SIZE = 256;

    private final SecretKey masterKey;
    private final Map<String, SealedEntry> entries = new ConcurrentHashMap<>();
    private final SecureRandom secureRandom = new SecureRandom();

    public SealedValueVault(OracleConfig config) {
        this.masterKey = loadMasterKey(config.getMasterKey());
    }

    @Override
    public SealedHandle seal(SealedType type, BigInteger value) {
        Objects.requireNonNull(type, "Type cannot be null");
        if (!type.fits(value)) {
            throw new IllegalArgumentException("Value does not fit " + type);
        }
        try {
            SecretKey dataKey = generateKey();
            byte[] iv = generateIV();
            byte[] ciphertext = encrypt(value.toByteArray(), dataKey, iv);
            byte[] wrappedKey = wrapKey(dataKey);

            SealedHandle handle = new SealedHandle("sealed:" + UUID.randomUUID(), type);
            entries.put(handle.id(), new SealedEntry(handle, ciphertext, wrappedKey, iv, ConcurrentHashMap.newKeySet()));
            return handle;
        } catch (GeneralSecurityException e) {
            throw new VaultException("Failed to seal value", e);
        }
    }

    @Override
    public void grantAccess(SealedHandle handle, Principal principal) {
        Objects.requireNonNull(principal, "Principal cannot be null");
        entry(handle).readers().add(principal);
    }

    @Override
    public boolean isAllowed(SealedHandle handle, Principal principal) {
        SealedEntry entry = entries.get(handle.id());
        return entry != null && entry.readers().contains(principal);
    }

    @Override
    public BigInteger unseal(SealedHandle handle, Principal reader) {
        SealedEntry entry = entry(handle);
        if (reader == null || !entry.readers().contains(reader)) {
            log.debug("Denied read of {} to {}", handle.id(), reader);
            throw new AuthorizationException("Principal not granted access to sealed value");
        }
        return open(entry);
    }

    /**
     * Oracle-side read, bypassing access lists. Only the decryption oracle calls this.
     */
    public BigInteger decryptForOracle(SealedHandle handle) {
        return open(entry(handle));
    }

    public boolean exists(SealedHandle handle) {
        return handle != null && entries.containsKey(handle.id());
    }

    public int size() {
        return entries.size();
    }

    // ==================== Private Methods ====================

    private SealedEntry entry(SealedHandle handle) {
        Objects.requireNonNull(handle, "Handle cannot be null");
        SealedEntry entry = entries.get(handle.id());
        if (entry == null) {
            throw new VaultException("Unknown sealed handle: " + handle.id());
        }
        if (entry.handle().type() != handle.type()) {
            throw new VaultException("Handle type mismatch for " + handle.id());
        }
        return entry;
    }

    private BigInteger open(SealedEntry entry) {
        try {
            SecretKey dataKey = unwrapKey(entry.wrappedKey());
            return new BigInteger(decrypt(entry.ciphertext(), dataKey, entry.iv()));
        } catch (GeneralSecurityException e) {
            throw new VaultException("Failed to open sealed value " + entry.handle().id(), e);
        }
    }

    private static SecretKey loadMasterKey(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            log.warn("No vault master key configured; generated an ephemeral key");
            try {
                return generateKey();
            } catch (GeneralSecurityException e) {
                throw new VaultException("Failed to generate master key", e);
            }
        }
        byte[] raw = Base64.getDecoder().decode(encoded);
        if (raw.length != KEY_SIZE / 8) {
            throw new IllegalArgumentException("Vault master key must be " + KEY_SIZE / 8 + " bytes");
        }
        return new SecretKeySpec(raw, "AES");
    }

    private static SecretKey generateKey() throws GeneralSecurityException {
        KeyGenerator keyGen = KeyGenerator.getInstance("AES");
        keyGen.init(KEY_SIZE);
        return keyGen.generateKey();
    }

    private byte[] generateIV() {
        byte[] iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);
        return iv;
    }

    private byte[] encrypt(byte[] data, SecretKey key, byte[] iv) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        return cipher.doFinal(data);
    }

    private byte[] decrypt(byte[] ciphertext, SecretKey key, byte[] iv) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        return cipher.doFinal(ciphertext);
    }

    private byte[] wrapKey(SecretKey keyToWrap) throws GeneralSecurityException {
        byte[] iv = generateIV();
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
        cipher.init(Cipher.WRAP_MODE, masterKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        byte[] wrapped = cipher.wrap(keyToWrap);

        // IV travels in front of the wrapped key
        byte[] result = new byte[iv.length + wrapped.length];
        System.arraycopy(iv, 0, result, 0, iv.length);
        System.arraycopy(wrapped, 0, result, iv.length, wrapped.length);
        return result;
    }

    private SecretKey unwrapKey(byte[] wrappedKeyWithIV) throws GeneralSecurityException {
        byte[] iv = Arrays.copyOfRange(wrappedKeyWithIV, 0, GCM_IV_LENGTH);
        byte[] wrapped = Arrays.copyOfRange(wrappedKeyWithIV, GCM_IV_LENGTH, wrappedKeyWithIV.length);
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
        cipher.init(Cipher.UNWRAP_MODE, masterKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        return (SecretKey) cipher.unwrap(wrapped, "AES", Cipher.SECRET_KEY);
    }

    private record SealedEntry(
            SealedHandle handle,
            byte[] ciphertext,
            byte[] wrappedKey,
            byte[] iv,
            Set<Principal> readers
    ) {}

    public static class VaultException extends RuntimeException {
        public VaultException(String message) { super(message); }
        public VaultException(String message, Throwable cause) { super(message, cause); }
    }
}
