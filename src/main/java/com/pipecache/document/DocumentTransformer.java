package com.pipecache.document;

import java.util.List;

public interface DocumentTransformer {
    List<Document> transform(List<Document> documents);

    default String name() {
        return getClass().getSimpleName();
    }
}
