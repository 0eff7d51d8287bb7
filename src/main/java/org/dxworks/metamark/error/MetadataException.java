package org.dxworks.metamark.error;

public class MetadataException extends MetaMarkException {

    public MetadataException(String message) {
        this(message, null);
    }

    public MetadataException(String message, Throwable cause) {
        super(ErrorKind.METADATA, 0, 0, message, "Invalid metadata: " + message, cause);
    }
}
