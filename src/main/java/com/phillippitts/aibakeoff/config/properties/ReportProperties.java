package com.phillippitts.aibakeoff.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Where the JSON report is written.
 */
@Validated
@ConfigurationProperties(prefix = "bakeoff.report")
public class ReportProperties {

    public static final String DEFAULT_FILE_NAME = "ai-bakeoff-report.json";

    @NotNull
    private final Path outputDir;

    @NotBlank
    private final String fileName;

    @ConstructorBinding
    public ReportProperties(Path outputDir, String fileName) {
        this.outputDir = outputDir == null ? Path.of("artifacts") : outputDir;
        this.fileName = fileName == null || fileName.isBlank() ? DEFAULT_FILE_NAME : fileName;
    }

    /**
     * Convenience constructor for tests (default file name).
     */
    public ReportProperties(Path outputDir) {
        this(outputDir, DEFAULT_FILE_NAME);
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getFileName() {
        return fileName;
    }

    public Path reportPath() {
        return outputDir.resolve(fileName);
    }
}
