package com.ryuqq.reportflow.core.text;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 자유 텍스트에서 백분율 수치 추출.
 *
 * <p>{@code %} 또는 {@code percent} 토큰 바로 앞의 첫 정수/소수를 찾아
 * [0, 100] 범위로 잘라 돌려줍니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>"roughly 65% of revenue" → 65.0</li>
 *   <li>"about 12.5 percent" → 12.5</li>
 *   <li>"140%" → 100.0</li>
 *   <li>"no estimate" → empty</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class PercentageExtractor {

    private static final Pattern PERCENT = Pattern.compile(
        "(\\d+(?:\\.\\d+)?)\\s*(?:%|percent\\b)", Pattern.CASE_INSENSITIVE);

    private PercentageExtractor() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param text 검색할 텍스트 (null 허용)
     * @return 첫 백분율 값, 없으면 empty
     */
    public static OptionalDouble extract(String text) {
        if (text == null || text.isEmpty()) {
            return OptionalDouble.empty();
        }
        Matcher matcher = PERCENT.matcher(text);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(matcher.group(1));
        return OptionalDouble.of(Math.max(0.0, Math.min(100.0, value)));
    }
}
