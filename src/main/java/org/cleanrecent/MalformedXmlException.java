package org.cleanrecent;

/**
 * The input could not be tokenized.
 */
public class MalformedXmlException extends BookmarkFilterException {

    private final long position;

    public MalformedXmlException(String message, long position) {
        super(message + " (at byte " + position + ")");
        this.position = position;
    }

    /** Byte offset into the input where the offending construct starts. */
    public long getPosition() {
        return position;
    }
}
