package org.nowstart.dca.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.dca.data.exception.ExchangeApiException;
import org.nowstart.dca.data.property.DcaProperties;
import org.nowstart.dca.service.dca.core.TradingPair;
import org.nowstart.dca.service.exchange.ExchangeGateway;

@ExtendWith(MockitoExtension.class)
class TradingPairResolverTest {

    @Mock
    private ExchangeGateway exchangeGateway;

    @Test
    void resolve_fetchesPairOnceAndCachesIt() {
        TradingPairResolver resolver = new TradingPairResolver(exchangeGateway, properties("XBTEUR"));
        TradingPair pair = new TradingPair("XXBTZEUR", "XBTEUR", "XXBT", "ZEUR", 8, 1, new BigDecimal("0.0001"));
        when(exchangeGateway.getTradingPair("XBTEUR")).thenReturn(pair);

        assertThat(resolver.resolve()).isEqualTo(pair);
        assertThat(resolver.resolve()).isEqualTo(pair);

        verify(exchangeGateway, times(1)).getTradingPair("XBTEUR");
    }

    @Test
    void resolve_retriesAfterFailure() {
        TradingPairResolver resolver = new TradingPairResolver(exchangeGateway, properties("XBTEUR"));
        TradingPair pair = new TradingPair("XXBTZEUR", "XBTEUR", "XXBT", "ZEUR", 8, 1, new BigDecimal("0.0001"));
        when(exchangeGateway.getTradingPair("XBTEUR"))
                .thenThrow(new ExchangeApiException("Kraken AssetPairs request failed with status 503"))
                .thenReturn(pair);

        assertThatThrownBy(resolver::resolve).isInstanceOf(ExchangeApiException.class);
        assertThat(resolver.resolve()).isEqualTo(pair);
    }

    static DcaProperties properties(String pair) {
        return new DcaProperties(
                "https://api.kraken.com",
                "",
                "",
                pair,
                1,
                new BigDecimal("50"),
                new BigDecimal("0.0026"),
                Duration.ofSeconds(1),
                Duration.ofHours(1)
        );
    }
}
