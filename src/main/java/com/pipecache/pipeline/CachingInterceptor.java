package com.pipecache.pipeline;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipecache.artifact.ArtifactLayer;
import com.pipecache.document.Document;
import com.pipecache.document.DocumentTransformer;

/**
 * Wraps a transformer so that each input document is transformed at most once.
 *
 * <p>An input is a cache hit when its logical id is stored and the layer holds children of its
 * hash tagged with this transformer's name. Hits return the stored children; misses run the
 * transformer on that single document and persist the input together with its outputs. Outputs
 * keep the order of the inputs they came from.</p>
 *
 * <p>An input for which the transformer returns nothing is never a hit and is transformed again
 * on the next call. Two writers racing on the same miss may both run the transformer; whichever
 * persists second skips the records that are already stored.</p>
 */
public class CachingInterceptor implements DocumentTransformer {
    private static final Logger log = LoggerFactory.getLogger(CachingInterceptor.class);

    public static final String TRANSFORMER_KEY = "transformer";

    private final ArtifactLayer artifactLayer;
    private final DocumentTransformer transformer;
    private final ExecutorService executor;

    public CachingInterceptor(ArtifactLayer artifactLayer, DocumentTransformer transformer) {
        this(artifactLayer, transformer, null);
    }

    public CachingInterceptor(ArtifactLayer artifactLayer, DocumentTransformer transformer, ExecutorService executor) {
        this.artifactLayer = Objects.requireNonNull(artifactLayer, "artifactLayer");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.executor = executor;
    }

    @Override
    public String name() {
        return transformer.name();
    }

    @Override
    public List<Document> transform(List<Document> documents) {
        // pick up results other writers stored since this layer last read the snapshot
        artifactLayer.refresh();
        List<Boolean> existence = artifactLayer.exists(documents.stream().map(Document::logicalId).toList());

        Map<String, List<Document>> outputsByInput = new HashMap<>();
        Map<String, Document> misses = new LinkedHashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            Document document = documents.get(i);
            if (outputsByInput.containsKey(document.hash()) || misses.containsKey(document.hash())) {
                continue;
            }
            if (existence.get(i)) {
                List<Document> cached = cachedChildren(document);
                if (!cached.isEmpty()) {
                    outputsByInput.put(document.hash(), cached);
                    continue;
                }
            }
            misses.put(document.hash(), document);
        }
        int hits = outputsByInput.size();

        if (executor == null) {
            for (Document document : misses.values()) {
                outputsByInput.put(document.hash(), persist(document, transformer.transform(List.of(document))));
            }
        } else {
            transformConcurrently(misses, outputsByInput);
        }

        List<Document> result = new ArrayList<>();
        for (Document document : documents) {
            result.addAll(outputsByInput.get(document.hash()));
        }
        log.info("Transformer {} handled {} documents: cacheHits={} transformed={} outputs={}",
                name(), documents.size(), hits, misses.size(), result.size());
        return result;
    }

    private void transformConcurrently(Map<String, Document> misses, Map<String, List<Document>> outputsByInput) {
        Map<String, Future<List<Document>>> futures = new LinkedHashMap<>();
        for (Document document : misses.values()) {
            futures.put(document.hash(), executor.submit(() -> transformer.transform(List.of(document))));
        }
        try {
            for (Map.Entry<String, Future<List<Document>>> entry : futures.entrySet()) {
                Document document = misses.get(entry.getKey());
                outputsByInput.put(document.hash(), persist(document, await(entry.getValue())));
            }
        } finally {
            futures.values().forEach(future -> future.cancel(true));
        }
    }

    private List<Document> await(Future<List<Document>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for transformer " + name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Transformer " + name() + " failed", cause);
        }
    }

    private List<Document> cachedChildren(Document document) {
        return artifactLayer.getChildDocuments(document.hash()).stream()
                .filter(child -> name().equals(child.metadata().get(TRANSFORMER_KEY)))
                .toList();
    }

    private List<Document> persist(Document input, List<Document> outputs) {
        Map<String, Document> linked = new LinkedHashMap<>();
        for (Document output : outputs) {
            Document child = output
                    .withParentHashes(List.of(input.hash()))
                    .withMetadataEntry(TRANSFORMER_KEY, name());
            linked.putIfAbsent(child.hash(), child);
        }
        List<Document> children = List.copyOf(linked.values());

        List<Document> batch = new ArrayList<>();
        batch.add(input);
        batch.addAll(children);
        artifactLayer.addMissing(batch);
        log.debug("Transformer {} produced {} documents for {}", name(), children.size(), input.logicalId());
        return children;
    }
}
