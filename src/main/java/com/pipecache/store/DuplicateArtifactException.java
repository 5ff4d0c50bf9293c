package com.pipecache.store;

public class DuplicateArtifactException extends ArtifactStoreException {

    private final String hash;

    public DuplicateArtifactException(String hash) {
        super("Artifact already exists: " + hash);
        this.hash = hash;
    }

    public String getHash() {
        return hash;
    }
}
