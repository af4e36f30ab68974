/**
 * Runner Adapter Layer - Worker Pool과 구성 루트.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.adapter.runner.QueueWorkerRunner} - 큐 하나의 lease 루프</li>
 *   <li>{@link com.ryuqq.reportflow.adapter.runner.WorkerPool} - 큐별 runner 레지스트리</li>
 *   <li>{@link com.ryuqq.reportflow.adapter.runner.ReportFlowSettings} - properties + 환경 변수 설정</li>
 *   <li>{@link com.ryuqq.reportflow.adapter.runner.ReportFlowBootstrap} - 전체 조립</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (QueueWorkerRunner, WorkerPool, ReportFlowBootstrap)
 *   ↓ implements
 * application (Runtime, ReportPipeline, DeliveryJobHandler)
 *   ↓ depends on
 * core (Job, JobHandler, JobQueue SPI, Ok/Fail)
 * </pre>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
package com.ryuqq.reportflow.adapter.runner;
