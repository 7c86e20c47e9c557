package org.cleanrecent.manifest.reporting;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Summary of one cleaning run, serialised as the JSON report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CleanReport {
    public String manifest;
    public String outputFile; // filtered copy; equals manifest once renamed over it
    public List<String> prefixes;
    public boolean dryRun;
    public int bookmarksSeen;
    public int bookmarksKept;
    public List<String> removedHrefs;
    public OffsetDateTime startedAt;
    public OffsetDateTime finishedAt;

    public int getBookmarksRemoved() {
        return removedHrefs == null ? 0 : removedHrefs.size();
    }
}
