package com.ryuqq.reportflow.core.spi;

import com.ryuqq.reportflow.core.contract.GeneratedText;
import com.ryuqq.reportflow.core.contract.GenerationRequest;

/**
 * Third-party text generation capability.
 *
 * <p>Implementations may return several text segments (for example when the
 * generator calls a search tool internally). Callers use {@link GeneratedText#text()}.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface TextGenerator {

    /**
     * @throws Exception on any transport or API failure
     */
    GeneratedText generate(GenerationRequest request) throws Exception;
}
