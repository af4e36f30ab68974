/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the boundaries to external collaborators. Adapter layers
 * (e.g., reportflow-adapter-inmemory) provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.core.spi.JobQueue} - Durable queue with delayed visibility</li>
 *   <li>{@link com.ryuqq.reportflow.core.spi.NotificationBus} - Tenant-keyed publish/subscribe</li>
 *   <li>{@link com.ryuqq.reportflow.core.spi.ReportRepository} - Report record store</li>
 *   <li>{@link com.ryuqq.reportflow.core.spi.NotificationRepository} - Durable notification records</li>
 *   <li>{@link com.ryuqq.reportflow.core.spi.TextGenerator} - Text generation</li>
 *   <li>{@link com.ryuqq.reportflow.core.spi.MailTransport} - Mail transport</li>
 *   <li>{@link com.ryuqq.reportflow.core.spi.EventChannel} - Client event stream</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.core.spi;
