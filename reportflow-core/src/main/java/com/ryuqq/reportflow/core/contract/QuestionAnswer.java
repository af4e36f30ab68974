package com.ryuqq.reportflow.core.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 가치 평가 설문의 질문/답변 한 쌍.
 *
 * @param question 질문 원문
 * @param answer 자유 텍스트 답변
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuestionAnswer(String question, String answer) {

    public QuestionAnswer {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question cannot be null or blank");
        }
        if (answer == null) {
            answer = "";
        }
    }
}
