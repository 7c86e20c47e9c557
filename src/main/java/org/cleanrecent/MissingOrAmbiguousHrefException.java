package org.cleanrecent;

/**
 * A {@code bookmark} start tag did not carry exactly one {@code href} attribute.
 */
public class MissingOrAmbiguousHrefException extends BookmarkFilterException {

    private final int hrefCount;

    public MissingOrAmbiguousHrefException(int hrefCount) {
        super("bookmark must have exactly one href attribute, found " + hrefCount);
        this.hrefCount = hrefCount;
    }

    public int getHrefCount() {
        return hrefCount;
    }
}
