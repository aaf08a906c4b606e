package org.nowstart.dca.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.dca.data.property.DcaProperties;
import org.nowstart.dca.service.dca.core.TradingPair;
import org.nowstart.dca.service.exchange.ExchangeGateway;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradingPairResolver {

    private final ExchangeGateway exchangeGateway;
    private final DcaProperties dcaProperties;

    private volatile TradingPair resolved;

    /**
     * Fetches the configured pair from the exchange on first use and caches it for the process lifetime.
     */
    public TradingPair resolve() {
        TradingPair pair = resolved;
        if (pair != null) {
            return pair;
        }

        synchronized (this) {
            if (resolved == null) {
                resolved = exchangeGateway.getTradingPair(dcaProperties.pair());
                log.info(
                        "event=dca_pair_resolved configured={} name={} alt_name={} base={} quote={} lot_decimals={} quote_decimals={} order_min={}",
                        dcaProperties.pair(),
                        resolved.name(),
                        resolved.altName(),
                        resolved.base(),
                        resolved.quote(),
                        resolved.lotDecimals(),
                        resolved.quoteDecimals(),
                        resolved.orderMin().toPlainString()
                );
            }
            return resolved;
        }
    }
}
