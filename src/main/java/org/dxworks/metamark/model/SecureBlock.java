package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Opaque encrypted region. The core carries the bytes through untouched.
 */
@JsonPropertyOrder({"content", "encryptionInfo"})
public final class SecureBlock extends Block {
    private final byte[] content;
    private final EncryptionInfo encryptionInfo;

    @JsonCreator
    public SecureBlock(@JsonProperty("content") byte[] content,
                       @JsonProperty("encryptionInfo") EncryptionInfo encryptionInfo) {
        this.content = content == null ? new byte[0] : content.clone();
        this.encryptionInfo = Objects.requireNonNull(encryptionInfo, "encryptionInfo");
    }

    public byte[] getContent() {
        return content.clone();
    }

    public EncryptionInfo getEncryptionInfo() {
        return encryptionInfo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecureBlock other)) return false;
        return Arrays.equals(content, other.content) && encryptionInfo.equals(other.encryptionInfo);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(content) + encryptionInfo.hashCode();
    }

    @Override
    public String toString() {
        return "SecureBlock{" + content.length + " bytes, algorithm=" + encryptionInfo.getAlgorithm() + "}";
    }
}
