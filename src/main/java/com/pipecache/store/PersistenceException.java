package com.pipecache.store;

public class PersistenceException extends ArtifactStoreException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
