package com.pipecache.pipeline;

import java.util.ArrayList;
import java.util.List;

import com.pipecache.artifact.ArtifactLayer;
import com.pipecache.document.Document;
import com.pipecache.document.DocumentTransformer;

public class TransformationPipeline implements DocumentTransformer {
    private final List<CachingInterceptor> steps;

    public TransformationPipeline(ArtifactLayer artifactLayer, List<? extends DocumentTransformer> transformers) {
        List<CachingInterceptor> wrapped = new ArrayList<>();
        for (DocumentTransformer transformer : transformers) {
            wrapped.add(new CachingInterceptor(artifactLayer, transformer));
        }
        this.steps = List.copyOf(wrapped);
    }

    public List<CachingInterceptor> steps() {
        return steps;
    }

    public List<Document> process(List<Document> documents) {
        List<Document> current = documents;
        for (CachingInterceptor step : steps) {
            current = step.transform(current);
        }
        return current;
    }

    @Override
    public List<Document> transform(List<Document> documents) {
        return process(documents);
    }

    @Override
    public String name() {
        return String.join(">", steps.stream().map(CachingInterceptor::name).toList());
    }
}
