package org.nowstart.dca.service.dca;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import org.nowstart.dca.data.exception.ExchangeApiException;
import org.nowstart.dca.data.exception.OrderTooSmallException;
import org.nowstart.dca.data.type.DcaOrderType;
import org.nowstart.dca.service.dca.core.DcaOrder;
import org.nowstart.dca.service.dca.core.TradingPair;

public class DcaOrderFactory {

    /**
     * Sizes a buy limit order spending at most {@code quoteAmount} at {@code askPrice}.
     * Volume is truncated to the pair's lot precision, never rounded up.
     */
    public DcaOrder buyLimit(
            Instant timestamp,
            TradingPair pair,
            BigDecimal quoteAmount,
            BigDecimal askPrice,
            BigDecimal takerFeeRate
    ) {
        if (askPrice == null || askPrice.signum() <= 0) {
            throw new ExchangeApiException("Invalid ask price for " + pair.name() + ": " + askPrice);
        }

        BigDecimal volume = quoteAmount.divide(askPrice, pair.lotDecimals(), RoundingMode.DOWN);
        BigDecimal limitPrice = askPrice.setScale(pair.quoteDecimals(), RoundingMode.HALF_EVEN);
        BigDecimal totalPrice = volume.multiply(limitPrice);
        BigDecimal fee = totalPrice.multiply(takerFeeRate);

        return new DcaOrder(
                timestamp,
                pair.name(),
                DcaOrderType.BUY_LIMIT,
                quoteAmount,
                askPrice,
                volume,
                limitPrice,
                fee,
                totalPrice,
                null,
                null
        );
    }

    public void validate(DcaOrder order, TradingPair pair) {
        if (order.volume().compareTo(pair.orderMin()) < 0) {
            throw new OrderTooSmallException(pair.base(), order.volume(), pair.orderMin());
        }
    }
}
