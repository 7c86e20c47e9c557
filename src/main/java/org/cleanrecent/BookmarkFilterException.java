package org.cleanrecent;

import java.io.IOException;

/**
 * Base type of every failure raised while filtering a manifest.
 * <p>
 * All failures are fatal for the current pass: the output produced so far must be discarded by the caller.
 */
public class BookmarkFilterException extends IOException {

    public BookmarkFilterException(String message) {
        super(message);
    }
}
