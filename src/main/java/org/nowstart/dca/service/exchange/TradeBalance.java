package org.nowstart.dca.service.exchange;

import java.math.BigDecimal;

public record TradeBalance(
        BigDecimal equivalentBalance,
        BigDecimal tradeBalance
) {
}
