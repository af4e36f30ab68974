/**
 * 외부 호출 deadline 적용.
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.application.protection;
