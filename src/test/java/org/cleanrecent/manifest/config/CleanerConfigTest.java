package org.cleanrecent.manifest.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.time.Clock;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CleanerConfig binding and validation
 */
@DisplayName("CleanerConfig Tests")
class CleanerConfigTest {

    private Validator validator;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class, ValidationAutoConfiguration.class))
            .withUserConfiguration(CleanerConfig.class, AppConfig.class);

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    @DisplayName("Defaults match the desktop manifest")
    void defaults() {
        CleanerConfig config = new CleanerConfig();
        assertNull(config.getDataDirectory());
        assertEquals("recently-used.xbel", config.getManifestFileName());
        assertFalse(config.isDryRun());
        assertFalse(config.getReport().isEnabled());
        assertTrue(validator.validate(config).isEmpty());
    }

    @Test
    @DisplayName("Should bind relaxed property names")
    void binding() {
        contextRunner
                .withPropertyValues(
                        "cleaner.data-directory=/data",
                        "cleaner.manifest-file-name=other.xbel",
                        "cleaner.dry-run=true",
                        "cleaner.report.enabled=true",
                        "cleaner.report.output-directory=/reports")
                .run(ctx -> {
                    assertTrue(ctx.containsBean("clock"));
                    assertNotNull(ctx.getBean(Clock.class));
                    CleanerConfig config = ctx.getBean(CleanerConfig.class);
                    assertEquals("/data", config.getDataDirectory());
                    assertEquals("other.xbel", config.getManifestFileName());
                    assertTrue(config.isDryRun());
                    assertTrue(config.getReport().isEnabled());
                    assertEquals("/reports", config.getReport().getOutputDirectory());
                });
    }

    @Test
    @DisplayName("Blank manifest name fails startup")
    void blankManifestName() {
        contextRunner
                .withPropertyValues("cleaner.manifest-file-name=")
                .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }

    @Test
    @DisplayName("Should validate nested report config")
    void nestedValidation() {
        CleanerConfig config = new CleanerConfig();
        config.getReport().setFileName(" ");
        Set<ConstraintViolation<CleanerConfig>> violations = validator.validate(config);
        assertEquals(1, violations.size());
        assertEquals("report.fileName", violations.iterator().next().getPropertyPath().toString());
    }
}
