package org.cleanrecent;

/**
 * Classified bookmark location.
 *
 * @param kind  whether the href addresses the local filesystem
 * @param value decoded href
 * @param path  local path with the {@code file://} scheme stripped, {@code null} for non-local hrefs
 */
public record Href(Kind kind, String value, String path) {

    public enum Kind { LOCAL, NON_LOCAL }

    static Href local(String value, String path) {
        return new Href(Kind.LOCAL, value, path);
    }

    static Href nonLocal(String value) {
        return new Href(Kind.NON_LOCAL, value, null);
    }

    public boolean isLocal() {
        return kind == Kind.LOCAL;
    }
}
