package org.cleanrecent;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable set of path prefixes selecting the bookmarks to remove.
 * <p>
 * Matching is a plain {@link String#startsWith} test and is not aware of path segments: {@code /home/a} matches
 * {@code /home/abc/file.txt} as well as {@code /home/a/file.txt}.
 */
public final class PathPrefixSet {

    private static final PathPrefixSet EMPTY = new PathPrefixSet(List.of());

    private final List<String> prefixes;

    private PathPrefixSet(List<String> prefixes) {
        this.prefixes = prefixes;
    }

    public static PathPrefixSet of(List<String> prefixes) {
        Objects.requireNonNull(prefixes, "prefixes must not be null");
        return prefixes.isEmpty() ? EMPTY : new PathPrefixSet(List.copyOf(prefixes));
    }

    /** True if {@code path} starts with any of the prefixes. */
    public boolean matches(String path) {
        for (String prefix : prefixes) {
            if (path.startsWith(prefix)) return true;
        }
        return false;
    }

    public List<String> prefixes() {
        return prefixes;
    }

    public boolean isEmpty() {
        return prefixes.isEmpty();
    }

    @Override
    public String toString() {
        return prefixes.toString();
    }
}
