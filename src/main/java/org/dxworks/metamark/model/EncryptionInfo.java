package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Describes how the payload of a {@link SecureBlock} was encrypted. The parser never
 * interprets these values.
 */
@JsonPropertyOrder({"algorithm", "keyId", "nonce"})
public final class EncryptionInfo {
    private final String algorithm;
    private final String keyId;
    private final byte[] nonce;

    @JsonCreator
    public EncryptionInfo(@JsonProperty("algorithm") String algorithm,
                          @JsonProperty("keyId") String keyId,
                          @JsonProperty("nonce") byte[] nonce) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.keyId = Objects.requireNonNull(keyId, "keyId");
        this.nonce = nonce == null ? new byte[0] : nonce.clone();
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public String getKeyId() {
        return keyId;
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncryptionInfo other)) return false;
        return algorithm.equals(other.algorithm) && keyId.equals(other.keyId) && Arrays.equals(nonce, other.nonce);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(algorithm, keyId) + Arrays.hashCode(nonce);
    }
}
