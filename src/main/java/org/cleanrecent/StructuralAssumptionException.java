package org.cleanrecent;

/**
 * The text following a removed bookmark was not pure whitespace, so the manifest is not the flat list this filter
 * knows how to rewrite.
 */
public class StructuralAssumptionException extends BookmarkFilterException {

    private final String text;

    public StructuralAssumptionException(String text, long position) {
        super("expected whitespace after removed bookmark at byte " + position + " but found: " + text);
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
