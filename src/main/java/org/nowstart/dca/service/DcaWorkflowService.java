package org.nowstart.dca.service;

import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.dca.data.exception.DcaException;
import org.nowstart.dca.data.property.DcaProperties;
import org.nowstart.dca.service.dca.DcaEngine;
import org.nowstart.dca.service.dca.core.DcaRunResult;
import org.nowstart.dca.service.dca.core.DcaSettings;
import org.nowstart.dca.service.dca.core.TradingPair;
import org.nowstart.dca.service.exchange.ExchangeGateway;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class DcaWorkflowService {

    private final ExchangeGateway exchangeGateway;
    private final DcaOrderHistory dcaOrderHistory;
    private final TradingPairResolver tradingPairResolver;
    private final DcaProperties dcaProperties;
    private final Clock clock;

    /**
     * Runs one DCA pass. Calls within this process are serialized so the scheduler and a manual trigger
     * cannot both pass the window check before either order reaches the exchange.
     */
    public synchronized DcaRunResult runOnce() {
        DcaSettings settings;
        try {
            settings = currentSettings();
        } catch (DcaException e) {
            log.error("event=dca_run pair={} outcome=failed reason=pair_resolution_failed message={}", dcaProperties.pair(), e.getMessage(), e);
            return DcaRunResult.failed(e);
        } catch (Exception e) {
            log.error("event=dca_run pair={} outcome=failed reason=pair_resolution_failed", dcaProperties.pair(), e);
            return DcaRunResult.unexpected(e);
        }

        log.info(
                "event=dca_run_start pair={} amount={} {} recurrence_days={}",
                settings.pair().name(),
                settings.quoteAmount().toPlainString(),
                settings.pair().quote(),
                settings.recurrenceDays()
        );
        DcaRunResult result;
        try {
            result = new DcaEngine(exchangeGateway, dcaOrderHistory, settings, clock).run();
        } catch (Exception e) {
            log.error("event=dca_run pair={} outcome=failed reason=unexpected_error", settings.pair().name(), e);
            return DcaRunResult.unexpected(e);
        }
        log.info("event=dca_run_finish pair={} outcome={} error_kind={}", settings.pair().name(), result.outcome(), result.errorKind());
        return result;
    }

    public DcaSettings currentSettings() {
        TradingPair pair = tradingPairResolver.resolve();
        return new DcaSettings(
                pair,
                dcaProperties.recurrenceDays(),
                dcaProperties.amount(),
                dcaProperties.takerFeeRate(),
                dcaProperties.clockTolerance()
        );
    }
}
