package com.pipecache.store;

public class IntegrityException extends ArtifactStoreException {

    private final String hash;

    public IntegrityException(String hash, String message) {
        super(message);
        this.hash = hash;
    }

    public IntegrityException(String hash, String message, Throwable cause) {
        super(message, cause);
        this.hash = hash;
    }

    public String getHash() {
        return hash;
    }
}
