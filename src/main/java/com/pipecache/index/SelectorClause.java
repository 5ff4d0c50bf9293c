package com.pipecache.index;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

public interface SelectorClause {
    boolean matches(Artifact artifact);

    record IdIn(Set<String> ids) implements SelectorClause {
        public IdIn {
            ids = Set.copyOf(ids);
        }

        @Override
        public boolean matches(Artifact artifact) {
            return ids.contains(artifact.logicalId());
        }
    }

    record HashIn(Set<String> hashes) implements SelectorClause {
        public HashIn {
            hashes = Set.copyOf(hashes);
        }

        @Override
        public boolean matches(Artifact artifact) {
            return hashes.contains(artifact.hash());
        }
    }

    record ParentHashIn(Set<String> parentHashes) implements SelectorClause {
        public ParentHashIn {
            parentHashes = Set.copyOf(parentHashes);
        }

        @Override
        public boolean matches(Artifact artifact) {
            return artifact.parentHashes().stream().anyMatch(parentHashes::contains);
        }
    }

    record MetadataEquals(String key, Object value) implements SelectorClause {
        public MetadataEquals {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public boolean matches(Artifact artifact) {
            return artifact.metadata().containsKey(key) && Objects.equals(artifact.metadata().get(key), value);
        }
    }

    record MetadataPrefix(String key, String prefix) implements SelectorClause {
        public MetadataPrefix {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(prefix, "prefix");
        }

        @Override
        public boolean matches(Artifact artifact) {
            Object value = artifact.metadata().get(key);
            return value != null && value.toString().startsWith(prefix);
        }
    }

    record StoredAfter(Instant instant) implements SelectorClause {
        public StoredAfter {
            Objects.requireNonNull(instant, "instant");
        }

        @Override
        public boolean matches(Artifact artifact) {
            return artifact.storedAt().map(storedAt -> storedAt.isAfter(instant)).orElse(false);
        }
    }

    record StoredBefore(Instant instant) implements SelectorClause {
        public StoredBefore {
            Objects.requireNonNull(instant, "instant");
        }

        @Override
        public boolean matches(Artifact artifact) {
            return artifact.storedAt().map(storedAt -> storedAt.isBefore(instant)).orElse(false);
        }
    }
}
