package org.cleanrecent.manifest;

import org.cleanrecent.BookmarkFilterException;
import org.cleanrecent.MalformedXmlException;
import org.cleanrecent.manifest.config.CleanerConfig;
import org.cleanrecent.manifest.reporting.CleanReport;
import org.cleanrecent.manifest.service.ManifestCleanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: removes entries under the given path prefixes from the desktop's recently used list.
 */
@SpringBootApplication
public class CleanRecentlyUsedApplication {

    private static final Logger logger = LoggerFactory.getLogger(CleanRecentlyUsedApplication.class);

    public static void main(String[] args) {
        // Check for help argument before starting Spring
        if (args.length > 0 && (args[0].equals("--help") || args[0].equals("-h"))) {
            printUsage(System.out);
            System.exit(0);
        }

        SpringApplication app = new SpringApplication(CleanRecentlyUsedApplication.class);
        app.run(args);
    }

    /**
     * Prints usage information
     */
    static void printUsage(PrintStream out) {
        out.println("\nClean Recently Used");
        out.println("Usage: java -jar clean-recently-used.jar [PREFIX...] [OPTIONS]");
        out.println("\nArguments:");
        out.println("  PREFIX                   Remove every local bookmark whose path starts with PREFIX");
        out.println("                           (plain string match: /home/a also matches /home/abc)");
        out.println("                           Empty prefixes are ignored, they would match every local bookmark");
        out.println("\nConfiguration Override Options:");
        out.println("  --cleaner.data-directory=DIR          Directory holding the manifest");
        out.println("  --cleaner.manifest-file-name=NAME     Manifest file name (default recently-used.xbel)");
        out.println("  --cleaner.dry-run=true                Keep the manifest, leave the filtered copy next to it");
        out.println("  --cleaner.report.enabled=true         Write a JSON report of the run");
        out.println("  --cleaner.report.output-directory=DIR Directory for the JSON report");
        out.println("  -h, --help                            Show this help message");
        out.println("\nExamples:");
        out.println("  java -jar clean-recently-used.jar /media/usb /tmp");
        out.println("  java -jar clean-recently-used.jar /mnt/old --cleaner.dry-run=true");
        out.println("");
    }

    @Bean
    public CommandLineRunner commandLineRunner(ManifestCleanService manifestCleanService, CleanerConfig cleanerConfig) {
        return args -> {
            int status = run(manifestCleanService, cleanerConfig, args);
            if (status != 0) {
                System.exit(status);
            }
        };
    }

    /**
     * Runs one cleaning pass and maps the outcome to a process exit status.
     */
    int run(ManifestCleanService manifestCleanService, CleanerConfig cleanerConfig, String[] args) {
        logger.info("Starting Clean Recently Used");
        try {
            List<String> prefixes = parsePrefixes(args);
            logCurrentConfiguration(cleanerConfig);

            CleanReport report = manifestCleanService.clean(prefixes);

            logFinalResults(report);
            return 0;
        } catch (MalformedXmlException e) {
            logger.error("Manifest left unchanged, it is not well-formed near byte {}: {}", e.getPosition(), e.getMessage());
            return 1;
        } catch (BookmarkFilterException e) {
            logger.error("Manifest left unchanged, it could not be filtered: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            logger.error("Error while cleaning the manifest", e);
            return 1;
        }
    }

    /**
     * Non-option arguments are the path prefixes; {@code --key=value} options belong to Spring.
     */
    static List<String> parsePrefixes(String[] args) {
        List<String> prefixes = new ArrayList<>();
        for (String arg : args) {
            if (arg.startsWith("--")) continue;
            if (arg.isEmpty()) {
                logger.warn("Ignoring empty prefix, it would match every local bookmark");
                continue;
            }
            prefixes.add(arg);
        }
        return prefixes;
    }

    private void logCurrentConfiguration(CleanerConfig config) {
        logger.info("=== CURRENT CONFIGURATION ===");
        logger.info("  Data Directory: {}", config.getDataDirectory() == null ? "(platform default)" : config.getDataDirectory());
        logger.info("  Manifest File Name: {}", config.getManifestFileName());
        logger.info("  Dry Run: {}", config.isDryRun());
        logger.info("  Report Enabled: {}", config.getReport().isEnabled());
        logger.info("=============================");
    }

    private void logFinalResults(CleanReport report) {
        logger.info("=== CLEAN RESULTS ===");
        logger.info("Manifest: {}", report.manifest);
        logger.info("Bookmarks Seen: {}", report.bookmarksSeen);
        logger.info("Bookmarks Kept: {}", report.bookmarksKept);
        logger.info("Bookmarks Removed: {}", report.getBookmarksRemoved());
        for (String href : report.removedHrefs) {
            logger.debug("  removed {}", href);
        }
        logger.info("=====================");
    }
}
