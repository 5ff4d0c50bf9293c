package com.pipecache.store;

public class ArtifactNotFoundException extends ArtifactStoreException {

    private final String key;

    public ArtifactNotFoundException(String key) {
        super("Artifact not found: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
