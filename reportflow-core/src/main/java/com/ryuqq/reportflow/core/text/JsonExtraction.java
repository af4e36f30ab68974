package com.ryuqq.reportflow.core.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 생성된 텍스트에서 JSON 부분 추출.
 *
 * <p>텍스트 생성 응답은 JSON을 설명 문장이나 코드 펜스로 감싸서 돌려주는 경우가 많습니다.
 * 추출은 파싱하지 않고 후보 문자열만 돌려주며, 파싱 실패 처리는 호출자의 몫입니다.</p>
 *
 * <p><strong>추출 순서:</strong></p>
 * <ol>
 *   <li>이미 깨끗한 JSON(첫 괄호가 마지막 문자에서 닫히는 {@code {...}} 또는 {@code [...]}) → trim 결과</li>
 *   <li>코드 펜스 블록({@code ```json ... ```} 또는 {@code ``` ... ```}) → 블록 내용 (trim)</li>
 *   <li>첫 {@code {} 부터 마지막 {@code }} 까지의 구간</li>
 *   <li>그 외 → 원문 trim</li>
 * </ol>
 *
 * <p>{@code [1] ... [2]} 처럼 인용 괄호로 시작하고 끝나는 문장은 깨끗한 JSON으로 보지 않습니다.
 * 첫 괄호의 짝이 마지막 문자가 아니기 때문입니다.</p>
 *
 * <p>깨끗한 JSON에 대해 멱등입니다: {@code extract(json).equals(json.trim())}.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class JsonExtraction {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*\\n?([\\s\\S]*?)\\n?```");
    private static final Pattern OBJECT_SPAN = Pattern.compile("\\{[\\s\\S]*\\}");

    private JsonExtraction() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * JSON 후보 문자열 추출.
     *
     * @param text 생성된 텍스트 (null이면 빈 문자열)
     * @return JSON 후보 문자열 (null 아님)
     */
    public static String extract(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (looksLikeJson(trimmed)) {
            return trimmed;
        }

        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            return fenced.group(1).trim();
        }

        Matcher object = OBJECT_SPAN.matcher(text);
        if (object.find()) {
            return object.group();
        }
        return trimmed;
    }

    private static boolean looksLikeJson(String trimmed) {
        if (trimmed.length() < 2) {
            return false;
        }
        char first = trimmed.charAt(0);
        char last = trimmed.charAt(trimmed.length() - 1);
        boolean wrapped = (first == '{' && last == '}') || (first == '[' && last == ']');
        return wrapped && closingIndex(trimmed) == trimmed.length() - 1;
    }

    /**
     * 첫 여는 괄호와 짝을 이루는 닫는 괄호 위치. 문자열 리터럴 안의 괄호는 무시합니다.
     *
     * @return 닫는 괄호 위치, 짝이 없으면 -1
     */
    private static int closingIndex(String text) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
