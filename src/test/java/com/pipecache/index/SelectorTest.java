package com.pipecache.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class SelectorTest {

    private final Artifact parent = new Artifact("x", "hashA", List.of(), Map.of("source", "https://wikipedia.org/a"));
    private final Artifact child = new Artifact("y", "hashB", List.of("hashA", "hashZ"), Map.of());

    @Test
    void shouldOnlyEvaluateSuppliedClauses() {
        Selector selector = Selector.builder().ids(null).hashes(null).parentHashes(Set.of("hashZ")).build();

        assertEquals(1, selector.clauses().size());
        assertFalse(selector.matches(parent));
        assertTrue(selector.matches(child));
    }

    @Test
    void shouldMatchAnyClause() {
        Selector selector = Selector.byIds(Set.of("x")).or(Selector.byParentHashes(Set.of("hashA")));

        assertTrue(selector.matches(parent));
        assertTrue(selector.matches(child));
    }

    @Test
    void shouldNotMatchWithEmptyClauseSets() {
        Selector selector = Selector.builder().ids(Set.of()).metadataPrefix("source", "ftp://").build();

        assertFalse(selector.isEmpty());
        assertFalse(selector.matches(parent));
        assertFalse(Selector.builder().build().matches(parent));
    }
}
