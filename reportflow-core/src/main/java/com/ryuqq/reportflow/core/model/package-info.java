/**
 * Core domain model package containing Value Objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.core.model.JobId} - Job unique identifier</li>
 *   <li>{@link com.ryuqq.reportflow.core.model.QueueName} - Durable queue name</li>
 *   <li>{@link com.ryuqq.reportflow.core.model.Payload} - Serialized job data</li>
 *   <li>{@link com.ryuqq.reportflow.core.model.TopicKey} - Tenant key for the notification bus</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Factory validation ensures data integrity</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.core.model;
