package com.ryuqq.reportflow.core.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JsonExtraction 테스트.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class JsonExtractionTest {

    @Test
    void extract_CleanJson_ReturnsTrimmedInput() {
        // Given
        String json = "  {\"summary\":\"x\",\"items\":[{\"a\":1},{\"b\":2}]}\n";

        // When & Then
        assertEquals(json.trim(), JsonExtraction.extract(json));
    }

    @Test
    void extract_CleanJsonArray_ReturnsTrimmedInput() {
        String json = "[{\"a\":1},{\"b\":2}] ";

        assertEquals(json.trim(), JsonExtraction.extract(json));
    }

    @Test
    void extract_IsIdempotent() {
        String once = JsonExtraction.extract("Here you go:\n```json\n{\"a\":1}\n```\nThanks");

        assertEquals(once, JsonExtraction.extract(once));
    }

    @Test
    void extract_FencedBlockWithLanguage_ReturnsBlockContent() {
        // Given
        String text = "Here is the result:\n```json\n{\"sectorName\":\"Retail\"}\n```\nLet me know.";

        // When & Then
        assertEquals("{\"sectorName\":\"Retail\"}", JsonExtraction.extract(text));
    }

    @Test
    void extract_FencedBlockWithoutLanguage_ReturnsBlockContent() {
        assertEquals("{\"a\":1}", JsonExtraction.extract("```\n{\"a\":1}\n```"));
    }

    @Test
    void extract_JsonInProse_ReturnsBraceSpan() {
        // Given
        String text = "The answer is {\"a\":{\"b\":1}} as requested.";

        // When & Then
        assertEquals("{\"a\":{\"b\":1}}", JsonExtraction.extract(text));
    }

    @Test
    void extract_NoJson_ReturnsTrimmedText() {
        assertEquals("no json here", JsonExtraction.extract("  no json here "));
        assertEquals("", JsonExtraction.extract(null));
    }

    @Test
    void extract_CitationBracketsAroundFencedBlock_ReturnsBlockContent() {
        // Given
        String text = "[1] Based on search results:\n```json\n{\"summary\":\"ok\"}\n```\nSources: [2]";

        // When & Then
        assertEquals("{\"summary\":\"ok\"}", JsonExtraction.extract(text));
    }

    @Test
    void extract_CitationBracketsAroundBareObject_ReturnsBraceSpan() {
        String text = "[1] Result {\"sectorName\":\"Retail\"} per [2]";

        assertEquals("{\"sectorName\":\"Retail\"}", JsonExtraction.extract(text));
    }

    @Test
    void extract_CleanJsonWithBracketsInStrings_ReturnsTrimmedInput() {
        String json = "{\"note\":\"see [1] and }\",\"items\":[1,2]}";

        assertEquals(json, JsonExtraction.extract(json));
    }
}
