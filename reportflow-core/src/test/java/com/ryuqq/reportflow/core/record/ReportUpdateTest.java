package com.ryuqq.reportflow.core.record;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReportUpdate 부분 갱신 테스트.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class ReportUpdateTest {

    @Test
    void applyTo_OnlySetFieldsChange() {
        // Given
        ReportRecord record = ReportUpdate.builder()
            .preAnalysisData("{\"summary\":\"x\"}")
            .deliveryError("old error")
            .build()
            .applyTo(ReportRecord.empty("r-1"));

        // When
        ReportRecord updated = ReportUpdate.builder()
            .deliveryStatus(DeliveryStatus.PENDING)
            .build()
            .applyTo(record);

        // Then
        assertEquals("{\"summary\":\"x\"}", updated.preAnalysisData());
        assertEquals("old error", updated.deliveryError());
        assertEquals(DeliveryStatus.PENDING, updated.deliveryStatus());
    }

    @Test
    void applyTo_ExplicitNullClearsField() {
        // Given
        ReportRecord record = ReportUpdate.builder().deliveryError("boom").build().applyTo(ReportRecord.empty("r-1"));

        // When
        ReportRecord cleared = ReportUpdate.builder().deliveryError(null).build().applyTo(record);

        // Then
        assertNull(cleared.deliveryError());
    }

    @Test
    void deliveryStatus_LaterStatusReplacesEarlier() {
        // Given
        ReportRecord delivered = ReportUpdate.builder()
            .deliveryStatus(DeliveryStatus.DELIVERED)
            .build()
            .applyTo(ReportRecord.empty("r-1"));

        // When
        ReportRecord failed = ReportUpdate.builder()
            .deliveryStatus(DeliveryStatus.DELIVERY_FAILED)
            .build()
            .applyTo(delivered);

        // Then
        assertEquals(DeliveryStatus.DELIVERY_FAILED, failed.deliveryStatus());
    }

    @Test
    void renderedDocument_IsCopiedOnWriteAndRead() {
        // Given
        byte[] document = {1, 2, 3};
        ReportRecord record = ReportUpdate.builder().renderedDocument(document).build().applyTo(ReportRecord.empty("r-1"));

        // When
        document[0] = 9;
        record.renderedDocument()[1] = 9;

        // Then
        assertArrayEquals(new byte[]{1, 2, 3}, record.renderedDocument());
        assertTrue(record.hasRenderedDocument());
    }

    @Test
    void builder_Empty_ContainsNothing() {
        ReportUpdate update = ReportUpdate.builder().build();

        assertTrue(update.isEmpty());
        assertEquals(ReportRecord.empty("r-1"), update.applyTo(ReportRecord.empty("r-1")));
    }
}
