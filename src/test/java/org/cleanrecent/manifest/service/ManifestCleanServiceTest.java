package org.cleanrecent.manifest.service;

import org.cleanrecent.UnrecognizedSchemeException;
import org.cleanrecent.manifest.config.CleanerConfig;
import org.cleanrecent.manifest.reporting.CleanReport;
import org.cleanrecent.manifest.reporting.JsonCleanReportWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ManifestCleanService
 */
@ExtendWith(MockitoExtension.class)
class ManifestCleanServiceTest {

    private static final String KEEP = "  <bookmark href=\"file:///home/me/A-File.txt\">\n  </bookmark>\n";
    private static final String DROP = "  <bookmark href=\"file:///tmp/A-File.txt\">\n  </bookmark>\n";
    private static final String HEAD = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<xbel version=\"1.0\">\n";
    private static final String TAIL = "</xbel>\n";

    @Mock
    private DataDirectoryLocator locator;

    @Mock
    private JsonCleanReportWriter reportWriter;

    @TempDir
    Path tempDir;

    private CleanerConfig config;
    private ManifestCleanService service;
    private Path manifest;

    @BeforeEach
    void setUp() {
        config = new CleanerConfig();
        config.setTimestampPattern("uuuuMMdd'T'HHmmss");
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);
        service = new ManifestCleanService(config, locator, reportWriter, clock);
        manifest = tempDir.resolve("recently-used.xbel");
        lenient().when(locator.dataDirectory()).thenReturn(tempDir);
    }

    private List<Path> directoryListing() throws IOException {
        try (Stream<Path> s = Files.list(tempDir)) {
            return s.sorted().toList();
        }
    }

    @Test
    void testClean_ReplacesManifest() throws IOException {
        Files.writeString(manifest, HEAD + DROP + KEEP + TAIL);

        CleanReport report = service.clean(List.of("/tmp"));

        assertEquals(HEAD + KEEP + TAIL, Files.readString(manifest));
        assertEquals(List.of(manifest), directoryListing());
        assertEquals(2, report.bookmarksSeen);
        assertEquals(1, report.bookmarksKept);
        assertEquals(List.of("file:///tmp/A-File.txt"), report.removedHrefs);
        assertEquals(List.of("/tmp"), report.prefixes);
        assertEquals(manifest.toString(), report.outputFile);
        assertFalse(report.dryRun);
        verify(reportWriter, never()).write(any(), any(), anyString());
    }

    @Test
    void testClean_DryRunKeepsOriginal() throws IOException {
        config.setDryRun(true);
        Files.writeString(manifest, HEAD + DROP + KEEP + TAIL);

        CleanReport report = service.clean(List.of("/tmp"));

        Path copy = tempDir.resolve("recently-used.xbel-20240301T101530");
        assertEquals(HEAD + DROP + KEEP + TAIL, Files.readString(manifest));
        assertEquals(HEAD + KEEP + TAIL, Files.readString(copy));
        assertEquals(copy.toString(), report.outputFile);
    }

    @Test
    void testClean_FailureLeavesManifestAndNoCopy() throws IOException {
        String original = HEAD + DROP + "  <bookmark href=\"http://example.com\">\n  </bookmark>\n" + TAIL;
        Files.writeString(manifest, original);

        assertThrows(UnrecognizedSchemeException.class, () -> service.clean(List.of("/tmp")));

        assertEquals(original, Files.readString(manifest));
        assertEquals(List.of(manifest), directoryListing());
    }

    @Test
    void testClean_MissingManifest() {
        assertThrows(NoSuchFileException.class, () -> service.clean(List.of("/tmp")));
        assertFalse(Files.exists(tempDir.resolve("recently-used.xbel-20240301T101530")));
    }

    @Test
    void testClean_ExistingOutputIsNotOverwritten() throws IOException {
        Files.writeString(manifest, HEAD + KEEP + TAIL);
        Path clash = tempDir.resolve("recently-used.xbel-20240301T101530");
        Files.writeString(clash, "someone else's file");

        assertThrows(FileAlreadyExistsException.class, () -> service.clean(List.of("/tmp")));

        assertEquals("someone else's file", Files.readString(clash));
    }

    @Test
    void testClean_ConfiguredDirectoryWinsOverLocator() throws IOException {
        Path other = Files.createDirectory(tempDir.resolve("other"));
        config.setDataDirectory(other.toString());
        config.setManifestFileName("custom.xbel");
        Files.writeString(other.resolve("custom.xbel"), HEAD + KEEP + TAIL);

        CleanReport report = service.clean(List.of());

        assertEquals(other.resolve("custom.xbel").toString(), report.manifest);
        assertEquals(HEAD + KEEP + TAIL, Files.readString(other.resolve("custom.xbel")));
        verify(locator, never()).dataDirectory();
    }

    @Test
    void testClean_WritesReportWhenEnabled() throws IOException {
        config.getReport().setEnabled(true);
        config.getReport().setOutputDirectory(tempDir.resolve("reports").toString());
        Files.writeString(manifest, HEAD + DROP + TAIL);
        when(reportWriter.write(any(), any(), anyString())).thenReturn(new File("r.json"));

        service.clean(List.of("/tmp"));

        verify(reportWriter).write(eq(tempDir.resolve("reports").toFile()), any(CleanReport.class),
                eq("clean-report-20240301-101530.json"));
    }

    @Test
    void testClean_ReportFailureDoesNotFailTheRun() throws IOException {
        config.getReport().setEnabled(true);
        config.getReport().setOutputDirectory(tempDir.resolve("reports").toString());
        Files.writeString(manifest, HEAD + DROP + KEEP + TAIL);
        when(reportWriter.write(any(), any(), anyString()))
                .thenThrow(new UncheckedIOException("Failed to write JSON clean report", new IOException("disk full")));

        CleanReport report = assertDoesNotThrow(() -> service.clean(List.of("/tmp")));

        assertEquals(HEAD + KEEP + TAIL, Files.readString(manifest));
        assertEquals(1, report.bookmarksKept);
        assertEquals(List.of(manifest), directoryListing());
    }
}
