/**
 * In-memory durable queue adapter.
 *
 * <p>Reference implementation of {@link com.ryuqq.reportflow.core.spi.JobQueue} with
 * clock-driven delayed visibility. Production deployments use an external broker.</p>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.adapter.inmemory.queue;
