package com.pipecache.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pipecache.artifact.FileSystemArtifactLayer;
import com.pipecache.document.Document;
import com.pipecache.document.DocumentTransformer;
import com.pipecache.index.Selector;

class CachingInterceptorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSkipTransformerForAlreadyProcessedDocument() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        WordSplitter splitter = new WordSplitter();
        CachingInterceptor interceptor = new CachingInterceptor(layer, splitter);
        Document input = Document.create("doc", "alpha beta gamma", Map.of());

        List<Document> first = interceptor.transform(List.of(input));
        List<Document> second = interceptor.transform(List.of(input));

        assertEquals(1, splitter.invocations.get());
        assertEquals(3, first.size());
        assertEquals(first, second);
    }

    @Test
    void shouldServeCacheHitsFromFreshLayerOverSameRoot() {
        WordSplitter splitter = new WordSplitter();
        Document input = Document.create("doc", "alpha beta", Map.of());
        List<Document> first = new CachingInterceptor(new FileSystemArtifactLayer(tempDir), splitter).transform(List.of(input));

        List<Document> second = new CachingInterceptor(new FileSystemArtifactLayer(tempDir), splitter).transform(List.of(input));

        assertEquals(1, splitter.invocations.get());
        assertEquals(first, second);
    }

    @Test
    void shouldServeCacheHitsAcrossLayersOpenedBeforeTheFirstRun() {
        FileSystemArtifactLayer first = new FileSystemArtifactLayer(tempDir);
        FileSystemArtifactLayer second = new FileSystemArtifactLayer(tempDir);
        WordSplitter splitter = new WordSplitter();
        Document input = Document.create("doc", "alpha beta", Map.of());

        List<Document> fromFirst = new CachingInterceptor(first, splitter).transform(List.of(input));
        List<Document> fromSecond = new CachingInterceptor(second, splitter).transform(List.of(input));

        assertEquals(1, splitter.invocations.get());
        assertEquals(fromFirst, fromSecond);
        assertEquals(3, second.index().size());
    }

    @Test
    void shouldPersistAfterAnotherWriterStoredTheSameResult() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        WordSplitter splitter = new WordSplitter();
        Document input = Document.create("doc", "alpha beta", Map.of());
        DocumentTransformer racing = new DocumentTransformer() {
            @Override
            public List<Document> transform(List<Document> documents) {
                List<Document> outputs = splitter.transform(documents);
                new CachingInterceptor(new FileSystemArtifactLayer(tempDir), splitter).transform(documents);
                return outputs;
            }

            @Override
            public String name() {
                return splitter.name();
            }
        };

        List<Document> outputs = new CachingInterceptor(layer, racing).transform(List.of(input));

        assertEquals(2, splitter.invocations.get());
        assertEquals(List.of("alpha", "beta"), texts(outputs));
        assertEquals(3, layer.index().size());
    }

    @Test
    void shouldLinkEveryOutputToItsInput() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        CachingInterceptor interceptor = new CachingInterceptor(layer, new WordSplitter());
        Document a = Document.create("a", "one two", Map.of());
        Document b = Document.create("b", "three", Map.of());

        List<Document> outputs = interceptor.transform(List.of(a, b));

        assertEquals(List.of(a.hash()), outputs.get(0).parentHashes());
        assertEquals(List.of(a.hash()), outputs.get(1).parentHashes());
        assertEquals(List.of(b.hash()), outputs.get(2).parentHashes());
        for (Document output : outputs) {
            assertEquals("WordSplitter", output.metadata().get(CachingInterceptor.TRANSFORMER_KEY));
            assertTrue(output.hashMatchesContent());
        }
        assertEquals(List.of(true, true), layer.existsByHash(List.of(a.hash(), b.hash())));
        assertEquals(outputs.subList(0, 2), layer.getChildDocuments(a.hash()));
    }

    @Test
    void shouldPreserveInputOrderAcrossHitsAndMisses() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        WordSplitter splitter = new WordSplitter();
        CachingInterceptor interceptor = new CachingInterceptor(layer, splitter);
        Document a = Document.create("a", "a1 a2", Map.of());
        Document b = Document.create("b", "b1", Map.of());
        Document c = Document.create("c", "c1 c2 c3", Map.of());
        interceptor.transform(List.of(b));

        List<Document> outputs = interceptor.transform(List.of(a, b, c));

        assertEquals(List.of("a1", "a2", "b1", "c1", "c2", "c3"), texts(outputs));
        assertEquals(3, splitter.invocations.get());
    }

    @Test
    void shouldTransformRepeatedInputOnceWithinOneCall() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        WordSplitter splitter = new WordSplitter();
        Document input = Document.create("doc", "x y", Map.of());

        List<Document> outputs = new CachingInterceptor(layer, splitter).transform(List.of(input, input));

        assertEquals(1, splitter.invocations.get());
        assertEquals(List.of("x", "y", "x", "y"), texts(outputs));
    }

    @Test
    void shouldReprocessChangedContentForSameLogicalId() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        WordSplitter splitter = new WordSplitter();
        CachingInterceptor interceptor = new CachingInterceptor(layer, splitter);

        interceptor.transform(List.of(Document.create("doc", "old text", Map.of())));
        List<Document> updated = interceptor.transform(List.of(Document.create("doc", "new words here", Map.of())));

        assertEquals(2, splitter.invocations.get());
        assertEquals(List.of("new", "words", "here"), texts(updated));
        assertEquals(2, layer.index().select(Selector.byIds(Set.of("doc"))).count());
    }

    @Test
    void shouldKeepCachesOfDifferentTransformersApart() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        WordSplitter splitter = new WordSplitter();
        UpperCaser upperCaser = new UpperCaser();
        Document input = Document.create("doc", "mixed Case", Map.of());

        new CachingInterceptor(layer, splitter).transform(List.of(input));
        List<Document> upper = new CachingInterceptor(layer, upperCaser).transform(List.of(input));
        List<Document> upperAgain = new CachingInterceptor(layer, upperCaser).transform(List.of(input));

        assertEquals(List.of("MIXED CASE"), texts(upper));
        assertEquals(upper, upperAgain);
        assertEquals(1, upperCaser.invocations.get());
    }

    @Test
    void shouldPropagateTransformerFailureUnchangedAndPersistNothingForIt() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        IllegalStateException failure = new IllegalStateException("parser crashed");
        DocumentTransformer failing = documents -> {
            throw failure;
        };
        Document input = Document.create("doc", "text", Map.of());

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> new CachingInterceptor(layer, failing).transform(List.of(input)));

        assertSame(failure, thrown);
        assertEquals(0, layer.index().size());
    }

    @Test
    void shouldKeepOrderWhenTransformingConcurrently() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        WordSplitter splitter = new WordSplitter();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CachingInterceptor interceptor = new CachingInterceptor(layer, splitter, executor);
            List<Document> inputs = new ArrayList<>();
            List<String> expected = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                inputs.add(Document.create("doc-" + i, "w" + i + "a w" + i + "b", Map.of()));
                expected.add("w" + i + "a");
                expected.add("w" + i + "b");
            }

            assertEquals(expected, texts(interceptor.transform(inputs)));
            assertEquals(expected, texts(interceptor.transform(inputs)));
            assertEquals(12, splitter.invocations.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldUnwrapTransformerFailureInConcurrentMode() {
        FileSystemArtifactLayer layer = new FileSystemArtifactLayer(tempDir);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            DocumentTransformer failing = documents -> {
                throw new UnsupportedOperationException("mime type not supported");
            };
            CachingInterceptor interceptor = new CachingInterceptor(layer, failing, executor);

            UnsupportedOperationException thrown = assertThrows(UnsupportedOperationException.class,
                    () -> interceptor.transform(List.of(Document.create("doc", "text", Map.of()))));

            assertEquals("mime type not supported", thrown.getMessage());
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<String> texts(List<Document> documents) {
        return documents.stream().map(Document::pageContent).toList();
    }

    static class WordSplitter implements DocumentTransformer {
        final AtomicInteger invocations = new AtomicInteger();

        @Override
        public List<Document> transform(List<Document> documents) {
            invocations.incrementAndGet();
            List<Document> outputs = new ArrayList<>();
            for (Document document : documents) {
                String[] words = document.pageContent().split("\\s+");
                for (int i = 0; i < words.length; i++) {
                    outputs.add(Document.create(document.logicalId() + "#" + i, words[i], Map.of("chunk", i)));
                }
            }
            return outputs;
        }
    }

    static class UpperCaser implements DocumentTransformer {
        final AtomicInteger invocations = new AtomicInteger();

        @Override
        public List<Document> transform(List<Document> documents) {
            invocations.incrementAndGet();
            return documents.stream()
                    .map(document -> Document.create(document.id(), document.pageContent().toUpperCase(), document.metadata()))
                    .toList();
        }
    }
}
