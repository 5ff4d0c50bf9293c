package com.pipecache.store;

import java.util.Set;

public interface ContentStore {

    void put(String hash, byte[] payload);

    byte[] get(String hash);

    boolean exists(String hash);

    boolean delete(String hash);

    Set<String> hashes();
}
