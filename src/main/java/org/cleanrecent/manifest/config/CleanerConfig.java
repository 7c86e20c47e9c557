package org.cleanrecent.manifest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the manifest cleaner
 */
@Component
@Validated
@ConfigurationProperties(prefix = "cleaner")
public class CleanerConfig {

    private String dataDirectory;  // Optional, defaults to the per-user data directory

    @NotBlank
    private String manifestFileName = "recently-used.xbel";

    @NotBlank
    private String timestampPattern = "uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSSXXX";

    private boolean dryRun = false;  // Keep the original and leave the filtered copy next to it

    @Valid
    @NotNull
    private ReportConfig report = new ReportConfig();

    public static class ReportConfig {
        private boolean enabled = false;
        @NotBlank
        private String outputDirectory = "./reports";
        @NotBlank
        private String fileName = "clean-report-{timestamp}.json";

        // Getters and Setters
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getOutputDirectory() { return outputDirectory; }
        public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }
        public String getFileName() { return fileName; }
        public void setFileName(String fileName) { this.fileName = fileName; }
    }

    // Main getters and setters
    public String getDataDirectory() { return dataDirectory; }
    public void setDataDirectory(String dataDirectory) { this.dataDirectory = dataDirectory; }
    public String getManifestFileName() { return manifestFileName; }
    public void setManifestFileName(String manifestFileName) { this.manifestFileName = manifestFileName; }
    public String getTimestampPattern() { return timestampPattern; }
    public void setTimestampPattern(String timestampPattern) { this.timestampPattern = timestampPattern; }
    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
    public ReportConfig getReport() { return report; }
    public void setReport(ReportConfig report) { this.report = report; }
}
