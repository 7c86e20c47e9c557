package org.cleanrecent.manifest.service;

import org.cleanrecent.BookmarkFilter;
import org.cleanrecent.FilterResult;
import org.cleanrecent.PathPrefixSet;
import org.cleanrecent.manifest.config.CleanerConfig;
import org.cleanrecent.manifest.reporting.CleanReport;
import org.cleanrecent.manifest.reporting.JsonCleanReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Rewrites the user's manifest without ever leaving it half-written: the filtered copy goes to a new sibling file
 * which replaces the manifest only after the whole pass succeeded.
 */
@Service
public class ManifestCleanService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManifestCleanService.class);

    private final CleanerConfig config;
    private final DataDirectoryLocator locator;
    private final JsonCleanReportWriter reportWriter;
    private final Clock clock;

    public ManifestCleanService(CleanerConfig config,
                                DataDirectoryLocator locator,
                                JsonCleanReportWriter reportWriter,
                                Clock clock) {
        this.config = config;
        this.locator = locator;
        this.reportWriter = reportWriter;
        this.clock = clock;
    }

    /**
     * Removes all bookmarks under {@code prefixes} from the manifest.
     *
     * @return summary of the run
     * @throws IOException if the manifest cannot be read, filtered or replaced; the manifest is then unchanged
     */
    public CleanReport clean(List<String> prefixes) throws IOException {
        CleanReport report = new CleanReport();
        report.startedAt = OffsetDateTime.now(clock);
        PathPrefixSet prefixSet = PathPrefixSet.of(prefixes);
        report.prefixes = prefixSet.prefixes();
        report.dryRun = config.isDryRun();

        Path manifest = resolveManifest();
        Path output = temporaryOutput(manifest, report.startedAt);
        report.manifest = manifest.toString();
        report.outputFile = output.toString();

        if (prefixSet.isEmpty()) {
            LOGGER.warn("No path prefixes given, the manifest will be rewritten unchanged");
        }
        LOGGER.info("Cleaning {} of bookmarks under {}", manifest, prefixSet);

        FilterResult result = filterInto(manifest, output, prefixSet.prefixes());
        report.bookmarksSeen = result.bookmarksSeen();
        report.bookmarksKept = result.bookmarksKept();
        report.removedHrefs = result.removedHrefs();

        if (config.isDryRun()) {
            LOGGER.info("Dry run: filtered copy left at {}", output);
        } else {
            replace(output, manifest);
            report.outputFile = manifest.toString();
        }
        report.finishedAt = OffsetDateTime.now(clock);

        LOGGER.info("Removed {} of {} bookmarks", result.bookmarksRemoved(), result.bookmarksSeen());
        writeReport(report);
        return report;
    }

    Path resolveManifest() {
        String dir = config.getDataDirectory();
        Path base = dir == null || dir.isBlank() ? locator.dataDirectory() : Paths.get(dir);
        return base.resolve(config.getManifestFileName());
    }

    Path temporaryOutput(Path manifest, OffsetDateTime now) {
        String stamp = DateTimeFormatter.ofPattern(config.getTimestampPattern()).format(now);
        return manifest.resolveSibling(manifest.getFileName() + "-" + stamp);
    }

    private FilterResult filterInto(Path manifest, Path output, List<String> prefixes) throws IOException {
        OutputStream created = Files.newOutputStream(output, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try (OutputStream out = new BufferedOutputStream(created);
             InputStream in = new BufferedInputStream(Files.newInputStream(manifest))) {
            return BookmarkFilter.filter(in, out, prefixes);
        } catch (IOException | RuntimeException e) {
            discard(output);
            throw e;
        }
    }

    private void replace(Path output, Path manifest) throws IOException {
        try {
            Files.move(output, manifest, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.warn("Atomic move not supported for {}, replacing non-atomically", manifest);
            Files.move(output, manifest, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discard(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            LOGGER.warn("Could not delete partial output {}", output, e);
        }
    }

    private void writeReport(CleanReport report) {
        CleanerConfig.ReportConfig rc = config.getReport();
        if (rc == null || !rc.isEnabled()) return;
        String stamp = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").format(report.startedAt);
        String fileName = rc.getFileName().replace("{timestamp}", stamp);
        try {
            File written = reportWriter.write(new File(rc.getOutputDirectory()), report, fileName);
            LOGGER.info("Report written to {}", written);
        } catch (UncheckedIOException e) {
            // the manifest is already in its final state here
            LOGGER.warn("Could not write clean report {}: {}", fileName, e.getMessage(), e);
        }
    }
}
