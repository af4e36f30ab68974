package com.ryuqq.reportflow.core.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 이메일 첨부 파일.
 *
 * <p>와이어 필드명은 메일 전송 API 형식({@code Name}, {@code Content},
 * {@code ContentID}, {@code ContentType})을 따릅니다.</p>
 *
 * @param name 파일 이름
 * @param contentBase64 base64 인코딩된 내용
 * @param contentId 본문 참조용 Content-ID
 * @param mimeType MIME 타입
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Attachment(
    @JsonProperty("Name") String name,
    @JsonProperty("Content") String contentBase64,
    @JsonProperty("ContentID") String contentId,
    @JsonProperty("ContentType") String mimeType
) {

    public Attachment {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (contentBase64 == null) {
            throw new IllegalArgumentException("contentBase64 cannot be null");
        }
        if (mimeType == null || mimeType.isBlank()) {
            mimeType = "application/octet-stream";
        }
    }
}
