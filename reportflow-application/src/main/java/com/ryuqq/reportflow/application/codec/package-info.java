/**
 * Jackson 기반 payload codec.
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.application.codec;
