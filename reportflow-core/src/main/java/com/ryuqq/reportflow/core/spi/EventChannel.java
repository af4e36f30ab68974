package com.ryuqq.reportflow.core.spi;

import com.ryuqq.reportflow.core.contract.StreamMessage;

import java.io.IOException;

/**
 * Long-lived per-client stream owned by the event stream gateway.
 *
 * <p>The gateway exposes this view of a connection; the core subscribes it to the
 * notification bus and relies on {@link #onClose(Runnable)} to release the subscription.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface EventChannel {

    /**
     * @throws IOException if the client is gone
     */
    void send(StreamMessage message) throws IOException;

    /**
     * Keeps the underlying connection open (disables idle timeouts).
     */
    void keepAlive();

    /**
     * Registers a callback run once when the client disconnects.
     */
    void onClose(Runnable callback);
}
