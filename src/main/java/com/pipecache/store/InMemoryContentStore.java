package com.pipecache.store;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryContentStore implements ContentStore {
    private final Map<String, byte[]> payloads = new ConcurrentHashMap<>();

    @Override
    public void put(String hash, byte[] payload) {
        byte[] copy = payload.clone();
        byte[] existing = payloads.putIfAbsent(hash, copy);
        if (existing != null && !Arrays.equals(existing, copy)) {
            throw new IntegrityException(hash, "Hash collision: " + hash + " is already stored with a different payload");
        }
    }

    @Override
    public byte[] get(String hash) {
        byte[] payload = payloads.get(hash);
        if (payload == null) {
            throw new ArtifactNotFoundException(hash);
        }
        return payload.clone();
    }

    @Override
    public boolean exists(String hash) {
        return payloads.containsKey(hash);
    }

    @Override
    public boolean delete(String hash) {
        return payloads.remove(hash) != null;
    }

    @Override
    public Set<String> hashes() {
        return Set.copyOf(payloads.keySet());
    }
}
