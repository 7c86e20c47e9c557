package org.cleanrecent.manifest.reporting;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;

@Component
public class JsonCleanReportWriter {
    private final ObjectMapper mapper;

    public JsonCleanReportWriter(ObjectMapper reportObjectMapper) {
        this.mapper = reportObjectMapper;
    }

    public File write(File outputDir, CleanReport report, String fileName) {
        try {
            if (!outputDir.exists() && !outputDir.mkdirs())
                throw new IOException("cannot create report directory " + outputDir);
            File out = new File(outputDir, fileName);
            mapper.writeValue(out, report);
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON clean report", e);
        }
    }
}
