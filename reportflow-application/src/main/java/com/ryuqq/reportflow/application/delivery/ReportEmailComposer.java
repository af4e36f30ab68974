package com.ryuqq.reportflow.application.delivery;

import com.ryuqq.reportflow.core.contract.Attachment;
import com.ryuqq.reportflow.core.contract.DeliveryMessage;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;

import java.time.Clock;
import java.time.Year;
import java.util.Base64;
import java.util.List;

/**
 * 리포트 완료 메일 작성기.
 *
 * <p>렌더링된 문서를 base64 PDF 첨부로 붙인 {@link DeliveryMessage}를 만듭니다.</p>
 *
 * <p><strong>형식:</strong></p>
 * <ul>
 *   <li>제목: {@code PDV Report - <orgName>}</li>
 *   <li>메일 subject: {@code Your <제목> is Ready}</li>
 *   <li>첨부: {@code <제목>.pdf}, ContentID {@code adv-report-pdf}, {@code application/pdf}</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class ReportEmailComposer {

    public static final String ATTACHMENT_CONTENT_ID = "adv-report-pdf";
    public static final String ATTACHMENT_MIME_TYPE = "application/pdf";

    private static final String[] REPORT_CONTENTS = {
        "Asset Data Valuation (PDV) calculations",
        "Preliminary Data Valuation questionnaire results",
        "Competitive analysis and market positioning",
        "Strategic recommendations"
    };

    private final String senderAddress;
    private final Clock clock;

    public ReportEmailComposer(String senderAddress, Clock clock) {
        if (senderAddress == null || senderAddress.isBlank()) {
            throw new IllegalArgumentException("senderAddress cannot be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.senderAddress = senderAddress;
        this.clock = clock;
    }

    /**
     * 리포트 완료 메일 작성.
     *
     * @param request 리포트 요청 (수신자가 있어야 함)
     * @param document 렌더링된 문서
     * @return 배달 메시지 (reportId가 상관관계 ID)
     * @throws IllegalArgumentException 수신자가 없거나 문서가 비어 있는 경우
     */
    public DeliveryMessage compose(ReportJobRequest request, byte[] document) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (document == null || document.length == 0) {
            throw new IllegalArgumentException("document cannot be null or empty");
        }
        String recipient = request.recipient()
            .orElseThrow(() -> new IllegalArgumentException("request has no recipient"));

        String title = reportTitle(request.orgName());
        Attachment pdf = new Attachment(
            title + ".pdf",
            Base64.getEncoder().encodeToString(document),
            ATTACHMENT_CONTENT_ID,
            ATTACHMENT_MIME_TYPE
        );

        return new DeliveryMessage(
            senderAddress,
            recipient,
            "Your " + title + " is Ready",
            htmlBody(title, request.orgName()),
            textBody(title, request.orgName()),
            List.of(pdf),
            request.reportId(),
            request.subdomain()
        );
    }

    public static String reportTitle(String orgName) {
        return "PDV Report - " + orgName;
    }

    String htmlBody(String title, String orgName) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head>\n<style>\n")
            .append("body { font-family: Arial, sans-serif; line-height: 1.6; color: #333; }\n")
            .append(".container { max-width: 600px; margin: 0 auto; padding: 20px; }\n")
            .append(".header { background-color: #2563eb; color: white; padding: 20px; text-align: center; }\n")
            .append(".content { background-color: #f9fafb; padding: 30px; }\n")
            .append(".footer { text-align: center; margin-top: 30px; color: #6b7280; font-size: 14px; }\n")
            .append("</style>\n</head>\n<body>\n<div class=\"container\">\n")
            .append("<div class=\"header\"><h1>Your PDV Report is Ready</h1></div>\n")
            .append("<div class=\"content\">\n")
            .append("<p>Hello,</p>\n")
            .append("<p>Your <strong>").append(escape(title)).append("</strong> for ").append(escape(orgName))
            .append(" has been generated and is attached to this email.</p>\n")
            .append("<p>The report contains a comprehensive assessment of your data assets including:</p>\n")
            .append("<ul>\n");
        for (String item : REPORT_CONTENTS) {
            html.append("<li>").append(item).append("</li>\n");
        }
        html.append("</ul>\n")
            .append("<p>Please find the complete report in the PDF attachment.</p>\n")
            .append("<p>If you have any questions about your report, please don't hesitate to contact your advisor.</p>\n")
            .append("</div>\n")
            .append("<div class=\"footer\"><p>&copy; ").append(currentYear()).append(" PDV Reports. All rights reserved.</p></div>\n")
            .append("</div>\n</body>\n</html>\n");
        return html.toString();
    }

    String textBody(String title, String orgName) {
        StringBuilder text = new StringBuilder();
        text.append("Your ").append(title).append(" is Ready\n\n")
            .append("Hello,\n\n")
            .append("Your ").append(title).append(" for ").append(orgName)
            .append(" has been generated and is attached to this email.\n\n")
            .append("The report contains a comprehensive assessment of your data assets including:\n");
        for (String item : REPORT_CONTENTS) {
            text.append("- ").append(item).append('\n');
        }
        text.append('\n')
            .append("Please find the complete report in the PDF attachment.\n\n")
            .append("If you have any questions about your report, please don't hesitate to contact your advisor.\n\n")
            .append("© ").append(currentYear()).append(" PDV Reports. All rights reserved.\n");
        return text.toString();
    }

    private int currentYear() {
        return Year.now(clock).getValue();
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }
}
