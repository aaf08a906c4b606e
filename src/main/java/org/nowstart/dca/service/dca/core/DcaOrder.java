package org.nowstart.dca.service.dca.core;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.dca.data.type.DcaOrderType;

/**
 * A buy limit order as decided by the engine. Exchange fields stay null until submission succeeds.
 */
public record DcaOrder(
        Instant timestamp,
        String pair,
        DcaOrderType type,
        BigDecimal quoteAmount,
        BigDecimal askPrice,
        BigDecimal volume,
        BigDecimal limitPrice,
        BigDecimal fee,
        BigDecimal totalPrice,
        String exchangeOrderId,
        String exchangeDescription
) {

    public DcaOrder withSubmission(String exchangeOrderId, String exchangeDescription) {
        return new DcaOrder(
                timestamp,
                pair,
                type,
                quoteAmount,
                askPrice,
                volume,
                limitPrice,
                fee,
                totalPrice,
                exchangeOrderId,
                exchangeDescription
        );
    }

    public boolean submitted() {
        return exchangeOrderId != null;
    }
}
