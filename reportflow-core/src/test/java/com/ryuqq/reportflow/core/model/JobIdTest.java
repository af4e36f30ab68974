package com.ryuqq.reportflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobId Value Object 테스트.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class JobIdTest {

    @Test
    void of_ValidValue_CreatesJobId() {
        // Given
        String value = "job-12345";

        // When
        JobId jobId = JobId.of(value);

        // Then
        assertEquals(value, jobId.getValue());
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> JobId.of("   ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> JobId.of("job:1"));
    }

    @Test
    void generate_ReturnsDistinctValidIds() {
        // When
        JobId first = JobId.generate();
        JobId second = JobId.generate();

        // Then
        assertNotEquals(first, second);
        assertEquals(first, JobId.of(first.getValue()));
    }
}
