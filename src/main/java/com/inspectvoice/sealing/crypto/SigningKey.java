package com.inspectvoice.sealing.crypto;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * HMAC key material paired with the id that manifests reference it by.
 * <p>
 * {@link #toString()} never prints the material.
 */
public final class SigningKey {

    private final String keyId;
    private final byte[] material;

    public SigningKey(String keyId, byte[] material) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId is required");
        }
        Objects.requireNonNull(material, "material");
        if (material.length == 0) {
            throw new IllegalArgumentException("key material for " + keyId + " is empty");
        }
        this.keyId = keyId;
        this.material = material.clone();
    }

    /**
     * Parses hex-encoded key material, the format keys are stored in the secret store.
     *
     * @throws IllegalArgumentException if the hex is malformed or empty
     */
    public static SigningKey fromHex(String keyId, String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("key material for " + keyId + " is empty");
        }
        byte[] material;
        try {
            material = HexFormat.of().parseHex(hex.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("key material for " + keyId + " is not valid hex", e);
        }
        return new SigningKey(keyId, material);
    }

    public String getKeyId() {
        return keyId;
    }

    byte[] material() {
        return material.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SigningKey)) {
            return false;
        }
        SigningKey that = (SigningKey) o;
        return keyId.equals(that.keyId) && Arrays.equals(material, that.material);
    }

    @Override
    public int hashCode() {
        return 31 * keyId.hashCode() + Arrays.hashCode(material);
    }

    @Override
    public String toString() {
        return "SigningKey{keyId='" + keyId + "'}";
    }
}
