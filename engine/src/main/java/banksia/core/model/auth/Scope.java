package banksia.core.model.auth;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An ordered set of distinct OAuth2 scope tokens.
 *
 * <p>Equality and inclusion are set based; iteration and {@link #toString()}
 * follow insertion order. The empty scope is valid and means that no scope
 * was requested.
 */
public final class Scope implements Iterable<String> {

    private static final Scope EMPTY = new Scope(Set.of());

    private final Set<String> tokens;

    private Scope(Set<String> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parse a space separated scope string.
     *
     * <p>Whitespace runs are treated as one separator, empty items are dropped
     * and duplicates keep their first position.
     *
     * @param text the scope string, may be null
     * @return the parsed scope, empty for null or blank input
     */
    public static Scope parse(String text) {
        if (text == null || text.isBlank()) {
            return EMPTY;
        }
        final var parsed = new LinkedHashSet<String>();
        for (var item : text.trim().split("\\s+")) {
            if (!item.isEmpty()) {
                parsed.add(item);
            }
        }
        return new Scope(Collections.unmodifiableSet(parsed));
    }

    public static Scope of(String... tokens) {
        return parse(String.join(" ", tokens));
    }

    public static Scope empty() {
        return EMPTY;
    }

    /**
     * Check whether every token of {@code other} is present in this scope.
     *
     * @param other the scope to test
     * @return true if {@code other} is a subset of this scope
     */
    public boolean includes(Scope other) {
        return tokens.containsAll(other.tokens);
    }

    public boolean contains(String token) {
        return tokens.contains(token);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public Iterator<String> iterator() {
        return tokens.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Scope other)) {
            return false;
        }
        return tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    /**
     * Canonical space separated form; round-trips through {@link #parse(String)}.
     */
    @Override
    public String toString() {
        return String.join(" ", tokens);
    }
}
