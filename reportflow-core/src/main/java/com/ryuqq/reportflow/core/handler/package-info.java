/**
 * Worker Pool이 호출하는 Job handler 계약.
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.core.handler;
