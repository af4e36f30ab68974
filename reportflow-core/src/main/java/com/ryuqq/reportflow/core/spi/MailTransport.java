package com.ryuqq.reportflow.core.spi;

import com.ryuqq.reportflow.core.contract.DeliveryMessage;
import com.ryuqq.reportflow.core.contract.MailReceipt;

/**
 * External mail transport.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface MailTransport {

    /**
     * Sends a message once.
     *
     * @throws Exception on any transport failure
     */
    MailReceipt send(DeliveryMessage message) throws Exception;
}
