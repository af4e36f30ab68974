/**
 * In-memory record stores for reports and notifications.
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.adapter.inmemory.store;
