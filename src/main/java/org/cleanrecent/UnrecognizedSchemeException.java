package org.cleanrecent;

/**
 * The decoded href of a bookmark uses a scheme outside the known allow-list.
 */
public class UnrecognizedSchemeException extends BookmarkFilterException {

    private final String href;

    public UnrecognizedSchemeException(String href) {
        super("href not recognized: " + href);
        this.href = href;
    }

    /** Decoded href that could not be classified. */
    public String getHref() {
        return href;
    }
}
