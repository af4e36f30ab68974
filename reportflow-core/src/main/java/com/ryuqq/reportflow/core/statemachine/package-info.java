/**
 * Job state machine package.
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * DELAYED → WAITING (visibility delay elapsed)
 * DELAYED → ACTIVE  (leased once eligible)
 * WAITING → ACTIVE  (leased)
 * ACTIVE → COMPLETED (handler returned)
 * ACTIVE → FAILED    (handler threw)
 *
 * Forbidden:
 * - COMPLETED → * (terminal state)
 * - FAILED → * (terminal state, no automatic requeue)
 * </pre>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.core.statemachine;
