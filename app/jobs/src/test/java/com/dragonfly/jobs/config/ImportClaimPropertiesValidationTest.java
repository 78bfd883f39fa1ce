package com.dragonfly.jobs.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImportClaimPropertiesValidationTest {

    private static final Duration STALENESS_WINDOW = Duration.ofMinutes(30);
    private static final Duration HEARTBEAT_INTERVAL = Duration.ofMinutes(1);
    private static final Duration SCAN_INTERVAL = Duration.ofMinutes(5);

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void validationPassesWhenAllFieldsValid() {
        ImportClaimProperties properties =
                new ImportClaimProperties(STALENESS_WINDOW, HEARTBEAT_INTERVAL, 3, true, SCAN_INTERVAL, 100);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenHeartbeatIsNotShorterThanStalenessWindow() {
        ImportClaimProperties properties =
                new ImportClaimProperties(STALENESS_WINDOW, STALENESS_WINDOW, 3, true, SCAN_INTERVAL, 100);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenStalenessWindowIsMissing() {
        ImportClaimProperties properties =
                new ImportClaimProperties(null, HEARTBEAT_INTERVAL, 3, true, SCAN_INTERVAL, 100);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenClaimMaxRetriesIsZero() {
        ImportClaimProperties properties =
                new ImportClaimProperties(STALENESS_WINDOW, HEARTBEAT_INTERVAL, 0, true, SCAN_INTERVAL, 100);

        assertFalse(validator.validate(properties).isEmpty());
    }
}
