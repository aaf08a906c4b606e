package org.nowstart.dca.service.dca.core;

import java.math.BigDecimal;
import java.time.Duration;

public record DcaSettings(
        TradingPair pair,
        int recurrenceDays,
        BigDecimal quoteAmount,
        BigDecimal takerFeeRate,
        Duration clockTolerance
) {

    public static final BigDecimal DEFAULT_TAKER_FEE_RATE = new BigDecimal("0.0026");
    public static final Duration DEFAULT_CLOCK_TOLERANCE = Duration.ofSeconds(1);

    public DcaSettings {
        if (pair == null) {
            throw new IllegalArgumentException("pair is required");
        }
        if (recurrenceDays < 1) {
            throw new IllegalArgumentException("recurrenceDays must be >= 1");
        }
        if (quoteAmount == null || quoteAmount.signum() <= 0) {
            throw new IllegalArgumentException("quoteAmount must be > 0");
        }
        takerFeeRate = takerFeeRate == null ? DEFAULT_TAKER_FEE_RATE : takerFeeRate;
        clockTolerance = clockTolerance == null ? DEFAULT_CLOCK_TOLERANCE : clockTolerance;
    }

    public DcaSettings(TradingPair pair, int recurrenceDays, BigDecimal quoteAmount) {
        this(pair, recurrenceDays, quoteAmount, DEFAULT_TAKER_FEE_RATE, DEFAULT_CLOCK_TOLERANCE);
    }
}
