package com.pipecache.index;

public enum WritePolicy {
    REJECT,
    UPSERT
}
