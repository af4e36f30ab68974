/**
 * 생성된 텍스트를 다루는 순수 파싱 함수 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.core.text.JsonExtraction} - 산문/코드 펜스에서 JSON 추출</li>
 *   <li>{@link com.ryuqq.reportflow.core.text.PercentageExtractor} - 백분율 수치 추출</li>
 *   <li>{@link com.ryuqq.reportflow.core.text.MarkdownParser} - 마크다운 부분 집합 파싱</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.core.text;
