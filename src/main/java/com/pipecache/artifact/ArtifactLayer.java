package com.pipecache.artifact;

import java.util.List;
import java.util.stream.Stream;

import com.pipecache.document.Document;
import com.pipecache.index.Selector;

public interface ArtifactLayer {

    void add(List<Document> documents);

    // skips documents whose hash is already indexed, returns the ones stored
    List<Document> addMissing(List<Document> documents);

    List<Boolean> exists(List<String> logicalIds);

    List<Boolean> existsByHash(List<String> hashes);

    Stream<Document> getMatchingDocuments(Selector selector);

    Stream<Document> getMatchingDocuments(Selector selector, ReadMode readMode);

    Document getDocument(String hash);

    List<Document> getChildDocuments(String parentHash);

    RemovalResult remove(Selector selector, boolean deletePayloads);

    int collectGarbage();

    void refresh();
}
