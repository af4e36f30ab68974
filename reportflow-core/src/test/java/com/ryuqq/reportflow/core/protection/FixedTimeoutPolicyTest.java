package com.ryuqq.reportflow.core.protection;

import com.ryuqq.reportflow.core.protection.noop.NoOpTimeoutPolicy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimeoutPolicy 구현체 테스트.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class FixedTimeoutPolicyTest {

    @Test
    void getPerCallTimeoutMs_OverrideWinsOverDefault() {
        // Given
        FixedTimeoutPolicy policy = new FixedTimeoutPolicy(60_000L, Map.of("mail.send", 10_000L));

        // When & Then
        assertEquals(10_000L, policy.getPerCallTimeoutMs("mail.send"));
        assertEquals(60_000L, policy.getPerCallTimeoutMs("text.generate"));
    }

    @Test
    void recordTimeout_CountsPerCallName() {
        // Given
        FixedTimeoutPolicy policy = new FixedTimeoutPolicy(1_000L);

        // When
        policy.recordTimeout("render", 1_001L);
        policy.recordTimeout("render", 1_002L);

        // Then
        assertEquals(2, policy.timeoutCount("render"));
        assertEquals(0, policy.timeoutCount("mail.send"));
    }

    @Test
    void negativeDefault_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new FixedTimeoutPolicy(-1));
    }

    @Test
    void noOp_HasNoDeadline() {
        assertEquals(0, new NoOpTimeoutPolicy().getPerCallTimeoutMs("anything"));
    }
}
