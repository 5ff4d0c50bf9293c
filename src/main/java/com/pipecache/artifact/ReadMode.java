package com.pipecache.artifact;

public enum ReadMode {
    // log and skip records that fail to load
    STREAMING,
    COMPLETE
}
