package com.pipecache.document;

public interface DocumentSerializer {
    byte[] serialize(Document document);

    Document deserialize(byte[] payload);
}
