package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.RefundRequest;
import com.fulfillment.pipeline.domain.RefundResult;

/**
 * Payment provider operations the pipeline initiates itself. Adapters map {@link RefundRequest} to
 * the provider API and normalize the response.
 */
public interface PaymentProviderClient {

    /**
     * Issue a full refund of a captured payment. Called at most once per order by the refund
     * orchestrator; there is no automatic retry.
     *
     * @return normalized result (never null); a failed refund is reported, not thrown
     */
    RefundResult issueRefund(RefundRequest request);
}
