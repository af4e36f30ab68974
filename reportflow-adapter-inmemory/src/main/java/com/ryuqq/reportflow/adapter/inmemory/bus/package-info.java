/**
 * In-memory notification bus adapter.
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.adapter.inmemory.bus;
