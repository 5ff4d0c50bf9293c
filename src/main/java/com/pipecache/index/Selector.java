package com.pipecache.index;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * A query over the metadata index made of independent clauses.
 *
 * <p>Clauses are combined with OR: an artifact matches as soon as any clause matches it.
 * Only the clauses that were supplied are evaluated, so a selector without clauses matches
 * nothing. For example a selector with an id clause for {@code "x"} and a parent clause for the
 * hash of {@code x} returns {@code x} and its children, not their intersection.</p>
 */
public final class Selector {
    private final List<SelectorClause> clauses;

    private Selector(List<SelectorClause> clauses) {
        this.clauses = List.copyOf(clauses);
    }

    public static Selector byIds(Collection<String> ids) {
        return builder().ids(ids).build();
    }

    public static Selector byHashes(Collection<String> hashes) {
        return builder().hashes(hashes).build();
    }

    public static Selector byParentHashes(Collection<String> parentHashes) {
        return builder().parentHashes(parentHashes).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<SelectorClause> clauses() {
        return clauses;
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public boolean matches(Artifact artifact) {
        for (SelectorClause clause : clauses) {
            if (clause.matches(artifact)) {
                return true;
            }
        }
        return false;
    }

    public Selector or(Selector other) {
        List<SelectorClause> combined = new ArrayList<>(clauses);
        combined.addAll(other.clauses);
        return new Selector(combined);
    }

    @Override
    public String toString() {
        return "Selector" + clauses;
    }

    public static final class Builder {
        private final List<SelectorClause> clauses = new ArrayList<>();

        private Builder() {
        }

        public Builder ids(Collection<String> ids) {
            if (ids != null) {
                clauses.add(new SelectorClause.IdIn(Set.copyOf(ids)));
            }
            return this;
        }

        public Builder hashes(Collection<String> hashes) {
            if (hashes != null) {
                clauses.add(new SelectorClause.HashIn(Set.copyOf(hashes)));
            }
            return this;
        }

        public Builder parentHashes(Collection<String> parentHashes) {
            if (parentHashes != null) {
                clauses.add(new SelectorClause.ParentHashIn(Set.copyOf(parentHashes)));
            }
            return this;
        }

        public Builder metadataEquals(String key, Object value) {
            clauses.add(new SelectorClause.MetadataEquals(key, value));
            return this;
        }

        public Builder metadataPrefix(String key, String prefix) {
            clauses.add(new SelectorClause.MetadataPrefix(key, prefix));
            return this;
        }

        public Builder storedAfter(Instant instant) {
            if (instant != null) {
                clauses.add(new SelectorClause.StoredAfter(instant));
            }
            return this;
        }

        public Builder storedBefore(Instant instant) {
            if (instant != null) {
                clauses.add(new SelectorClause.StoredBefore(instant));
            }
            return this;
        }

        public Builder clause(SelectorClause clause) {
            clauses.add(clause);
            return this;
        }

        public Selector build() {
            return new Selector(clauses);
        }
    }
}
