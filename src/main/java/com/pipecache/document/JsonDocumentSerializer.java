package com.pipecache.document;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JsonDocumentSerializer implements DocumentSerializer {
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    @Override
    public byte[] serialize(Document document) {
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize document " + document.hash(), e);
        }
    }

    @Override
    public Document deserialize(byte[] payload) {
        try {
            return objectMapper.readValue(payload, Document.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Payload is not a serialized document", e);
        }
    }
}
