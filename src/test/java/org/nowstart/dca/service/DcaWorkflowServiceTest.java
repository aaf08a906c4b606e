package org.nowstart.dca.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.dca.data.exception.ExchangeApiException;
import org.nowstart.dca.data.type.DcaErrorKind;
import org.nowstart.dca.data.type.DcaOutcome;
import org.nowstart.dca.service.dca.core.DcaRunResult;
import org.nowstart.dca.service.dca.core.DcaSettings;
import org.nowstart.dca.service.dca.core.TradingPair;
import org.nowstart.dca.service.exchange.ExchangeGateway;
import org.nowstart.dca.service.exchange.ExchangeOrderSummary;
import org.nowstart.dca.service.exchange.TradeBalance;

@ExtendWith(MockitoExtension.class)
class DcaWorkflowServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-21T10:15:30Z");
    private static final TradingPair PAIR = new TradingPair("XXBTZEUR", "XBTEUR", "XXBT", "ZEUR", 8, 1, new BigDecimal("0.0001"));

    @Mock
    private ExchangeGateway exchangeGateway;
    @Mock
    private DcaOrderHistory dcaOrderHistory;
    @Mock
    private TradingPairResolver tradingPairResolver;

    @Test
    void runOnce_reportsPairResolutionFailureAsExchangeError() {
        DcaWorkflowService service = service();
        when(tradingPairResolver.resolve()).thenThrow(new ExchangeApiException("Kraken AssetPairs failed: EQuery:Unknown asset pair"));

        DcaRunResult result = service.runOnce();

        assertThat(result.outcome()).isEqualTo(DcaOutcome.FAILED);
        assertThat(result.errorKind()).isEqualTo(DcaErrorKind.EXCHANGE_ERROR);
        assertThat(result.message()).contains("Unknown asset pair");
        verify(exchangeGateway, never()).getServerTime();
    }

    @Test
    void runOnce_reportsUnexpectedResolutionErrorAsInternal() {
        DcaWorkflowService service = service();
        when(tradingPairResolver.resolve()).thenThrow(new IllegalStateException("resolver unavailable"));

        DcaRunResult result = service.runOnce();

        assertThat(result.outcome()).isEqualTo(DcaOutcome.FAILED);
        assertThat(result.errorKind()).isEqualTo(DcaErrorKind.INTERNAL);
        assertThat(result.message()).isEqualTo("resolver unavailable");
    }

    @Test
    void runOnce_catchesUnexpectedEngineErrorInsteadOfThrowing() {
        DcaWorkflowService service = service();
        when(tradingPairResolver.resolve()).thenReturn(PAIR);
        when(exchangeGateway.getServerTime()).thenThrow(new IllegalStateException("Kraken API secret is not configured"));

        DcaRunResult result = service.runOnce();

        assertThat(result.outcome()).isEqualTo(DcaOutcome.FAILED);
        assertThat(result.errorKind()).isEqualTo(DcaErrorKind.INTERNAL);
        assertThat(result.message()).contains("secret is not configured");
        verify(dcaOrderHistory, never()).append(any());
    }

    @Test
    void runOnce_runsEngineWithConfiguredSettings() {
        DcaWorkflowService service = service();
        when(tradingPairResolver.resolve()).thenReturn(PAIR);
        when(exchangeGateway.getServerTime()).thenReturn(NOW);
        when(exchangeGateway.getTradeBalance()).thenReturn(new TradeBalance(new BigDecimal("500"), new BigDecimal("500")));
        when(exchangeGateway.getBalance()).thenReturn(Map.of("ZEUR", new BigDecimal("500")));
        when(exchangeGateway.getOpenOrders()).thenReturn(Map.of());
        when(exchangeGateway.getClosedOrders(any(), any()))
                .thenReturn(Map.of("C-1", new ExchangeOrderSummary("C-1", "XBTEUR", "closed", "buy")));

        DcaRunResult result = service.runOnce();

        assertThat(result.outcome()).isEqualTo(DcaOutcome.ALREADY_ORDERED);
        verify(dcaOrderHistory, never()).append(any());
    }

    @Test
    void currentSettings_combinesResolvedPairWithProperties() {
        DcaWorkflowService service = service();
        when(tradingPairResolver.resolve()).thenReturn(PAIR);

        DcaSettings settings = service.currentSettings();

        assertThat(settings.pair()).isEqualTo(PAIR);
        assertThat(settings.recurrenceDays()).isEqualTo(1);
        assertThat(settings.quoteAmount()).isEqualByComparingTo("50");
        assertThat(settings.takerFeeRate()).isEqualByComparingTo("0.0026");
        assertThat(settings.clockTolerance()).isEqualTo(Duration.ofSeconds(1));
    }

    private DcaWorkflowService service() {
        return new DcaWorkflowService(
                exchangeGateway,
                dcaOrderHistory,
                tradingPairResolver,
                TradingPairResolverTest.properties("XBTEUR"),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }
}
