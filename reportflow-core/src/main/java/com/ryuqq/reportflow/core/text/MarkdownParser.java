package com.ryuqq.reportflow.core.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 생성된 서술 텍스트용 마크다운 부분 집합 파서.
 *
 * <p>문서 렌더러가 좌표 계산 없이 구조만 받아 그릴 수 있도록 텍스트를 블록 목록으로
 * 바꿉니다. 순수 함수이며 상태가 없습니다.</p>
 *
 * <p><strong>블록 문법 (줄 단위):</strong></p>
 * <ul>
 *   <li>{@code # }, {@code ## }, {@code ### } → HEADING (level 1~3)</li>
 *   <li>{@code - } 또는 {@code * } → BULLET</li>
 *   <li>{@code 1. } → NUMBERED (level = 번호)</li>
 *   <li>빈 줄 → 블록 구분</li>
 *   <li>그 외 연속된 줄 → 하나의 PARAGRAPH (공백으로 연결)</li>
 * </ul>
 *
 * <p><strong>인라인 문법:</strong></p>
 * <ul>
 *   <li>{@code **bold**}, {@code __bold__} → BOLD</li>
 *   <li>{@code *italic*}, {@code _italic_} → ITALIC ({@code _}는 단어 경계에서만)</li>
 *   <li>{@code `code`} → CODE</li>
 * </ul>
 *
 * <p>닫히지 않은 마커는 일반 텍스트로 남습니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class MarkdownParser {

    private static final Pattern HEADING = Pattern.compile("^(#{1,3})\\s+(.*)$");
    private static final Pattern BULLET = Pattern.compile("^\\s*[-*]\\s+(.*)$");
    private static final Pattern NUMBERED = Pattern.compile("^\\s*(\\d+)\\.\\s+(.*)$");

    private static final Pattern INLINE = Pattern.compile(
        "\\*\\*(.+?)\\*\\*"
            + "|__(.+?)__"
            + "|`([^`]+)`"
            + "|\\*([^*\\s][^*]*?)\\*"
            + "|(?<![A-Za-z0-9])_([^_\\s][^_]*?)_(?![A-Za-z0-9])");

    private MarkdownParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 텍스트를 블록 목록으로 파싱.
     *
     * @param text 마크다운 텍스트 (null이면 빈 목록)
     * @return 블록 목록 (원문 순서)
     */
    public static List<MarkdownBlock> parse(String text) {
        List<MarkdownBlock> blocks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return blocks;
        }

        StringBuilder paragraph = new StringBuilder();
        for (String rawLine : text.split("\\r?\\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                flushParagraph(paragraph, blocks);
                continue;
            }

            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                flushParagraph(paragraph, blocks);
                blocks.add(new MarkdownBlock(MarkdownBlock.Type.HEADING, heading.group(1).length(),
                    parseInline(heading.group(2).strip())));
                continue;
            }

            Matcher bullet = BULLET.matcher(line);
            if (bullet.matches()) {
                flushParagraph(paragraph, blocks);
                blocks.add(new MarkdownBlock(MarkdownBlock.Type.BULLET, 0, parseInline(bullet.group(1).strip())));
                continue;
            }

            Matcher numbered = NUMBERED.matcher(line);
            if (numbered.matches()) {
                flushParagraph(paragraph, blocks);
                blocks.add(new MarkdownBlock(MarkdownBlock.Type.NUMBERED, parseNumber(numbered.group(1)),
                    parseInline(numbered.group(2).strip())));
                continue;
            }

            if (paragraph.length() > 0) {
                paragraph.append(' ');
            }
            paragraph.append(line);
        }
        flushParagraph(paragraph, blocks);
        return blocks;
    }

    /**
     * 한 줄의 인라인 마커 파싱.
     *
     * @param text 한 줄 텍스트 (null이면 빈 목록)
     * @return 인접한 PLAIN 조각이 합쳐진 조각 목록
     */
    public static List<InlineSegment> parseInline(String text) {
        List<InlineSegment> segments = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return segments;
        }

        Matcher matcher = INLINE.matcher(text);
        int cursor = 0;
        while (matcher.find()) {
            if (matcher.start() > cursor) {
                appendPlain(segments, text.substring(cursor, matcher.start()));
            }
            if (matcher.group(1) != null) {
                segments.add(new InlineSegment(InlineSegment.Style.BOLD, matcher.group(1)));
            } else if (matcher.group(2) != null) {
                segments.add(new InlineSegment(InlineSegment.Style.BOLD, matcher.group(2)));
            } else if (matcher.group(3) != null) {
                segments.add(new InlineSegment(InlineSegment.Style.CODE, matcher.group(3)));
            } else if (matcher.group(4) != null) {
                segments.add(new InlineSegment(InlineSegment.Style.ITALIC, matcher.group(4)));
            } else {
                segments.add(new InlineSegment(InlineSegment.Style.ITALIC, matcher.group(5)));
            }
            cursor = matcher.end();
        }
        if (cursor < text.length()) {
            appendPlain(segments, text.substring(cursor));
        }
        return segments;
    }

    private static void flushParagraph(StringBuilder paragraph, List<MarkdownBlock> blocks) {
        if (paragraph.length() == 0) {
            return;
        }
        blocks.add(new MarkdownBlock(MarkdownBlock.Type.PARAGRAPH, 0, parseInline(paragraph.toString())));
        paragraph.setLength(0);
    }

    private static void appendPlain(List<InlineSegment> segments, String text) {
        int last = segments.size() - 1;
        if (last >= 0 && segments.get(last).style() == InlineSegment.Style.PLAIN) {
            segments.set(last, InlineSegment.plain(segments.get(last).text() + text));
        } else {
            segments.add(InlineSegment.plain(text));
        }
    }

    private static int parseNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // 너무 긴 번호
            return 0;
        }
    }
}
