/**
 * Reusable contract tests for SPI adapters.
 *
 * <p>Adapter modules extend these classes to prove their implementations honor the
 * {@link com.ryuqq.reportflow.core.spi.JobQueue} and
 * {@link com.ryuqq.reportflow.core.spi.NotificationBus} contracts.</p>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.testkit.contract;
