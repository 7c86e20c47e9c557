package org.cleanrecent;

import java.util.List;

/**
 * Outcome of one successful pass.
 *
 * @param bookmarksSeen number of {@code bookmark} elements encountered
 * @param bookmarksKept number of them written to the output
 * @param removedHrefs  decoded hrefs of the removed bookmarks, in document order
 */
public record FilterResult(int bookmarksSeen, int bookmarksKept, List<String> removedHrefs) {

    public FilterResult {
        removedHrefs = List.copyOf(removedHrefs);
    }

    public int bookmarksRemoved() {
        return removedHrefs.size();
    }
}
