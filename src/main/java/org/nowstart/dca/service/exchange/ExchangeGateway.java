package org.nowstart.dca.service.exchange;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.nowstart.dca.service.dca.core.TradingPair;

/**
 * Exchange operations the DCA engine depends on. Implementations throw
 * {@link org.nowstart.dca.data.exception.DcaException} subclasses on failure.
 */
public interface ExchangeGateway {

    Instant getServerTime();

    TradeBalance getTradeBalance();

    /**
     * Balances keyed by currency code. Currencies without a balance may be absent.
     */
    Map<String, BigDecimal> getBalance();

    Map<String, ExchangeOrderSummary> getOpenOrders();

    Map<String, ExchangeOrderSummary> getClosedOrders(Instant start, CloseTimeFilter closeTime);

    BigDecimal getAskPrice(String pair);

    SubmittedOrder submitLimitBuy(String pair, BigDecimal volume, BigDecimal limitPrice);

    /**
     * Looks up trading rules of a pair given either its canonical or alternate name.
     */
    TradingPair getTradingPair(String pair);
}
