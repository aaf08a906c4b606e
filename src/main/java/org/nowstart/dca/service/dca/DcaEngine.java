package org.nowstart.dca.service.dca;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.dca.data.exception.ClockSkewException;
import org.nowstart.dca.data.exception.DcaException;
import org.nowstart.dca.data.exception.ExchangeApiException;
import org.nowstart.dca.data.exception.InsufficientFundsException;
import org.nowstart.dca.data.exception.OrderPersistenceException;
import org.nowstart.dca.data.exception.OrderSubmissionException;
import org.nowstart.dca.service.DcaOrderHistory;
import org.nowstart.dca.service.dca.core.DcaOrder;
import org.nowstart.dca.service.dca.core.DcaRunResult;
import org.nowstart.dca.service.dca.core.DcaSettings;
import org.nowstart.dca.service.dca.core.TradingPair;
import org.nowstart.dca.service.exchange.CloseTimeFilter;
import org.nowstart.dca.service.exchange.ExchangeGateway;
import org.nowstart.dca.service.exchange.ExchangeOrderSummary;
import org.nowstart.dca.service.exchange.SubmittedOrder;
import org.nowstart.dca.service.exchange.TradeBalance;

/**
 * Decides whether the recurring buy for one pair is due and places it.
 *
 * <p>Each {@link #run()} is one sequential pass: clock check, balance check, window order count and,
 * when no order exists in the window, price fetch, sizing, submission and persistence. The engine keeps
 * no state between runs; the exchange order ledger is the only record of previous buys, so two runs
 * overlapping in time can both see an empty window.
 */
@Slf4j
public class DcaEngine {

    private final ExchangeGateway exchangeGateway;
    private final DcaOrderHistory orderHistory;
    private final DcaSettings settings;
    private final Clock clock;
    private final DcaOrderFactory orderFactory;

    public DcaEngine(ExchangeGateway exchangeGateway, DcaOrderHistory orderHistory, DcaSettings settings, Clock clock) {
        this(exchangeGateway, orderHistory, settings, clock, new DcaOrderFactory());
    }

    DcaEngine(
            ExchangeGateway exchangeGateway,
            DcaOrderHistory orderHistory,
            DcaSettings settings,
            Clock clock,
            DcaOrderFactory orderFactory
    ) {
        this.exchangeGateway = exchangeGateway;
        this.orderHistory = orderHistory;
        this.settings = settings;
        this.clock = clock;
        this.orderFactory = orderFactory;
    }

    public DcaSettings settings() {
        return settings;
    }

    public DcaRunResult run() {
        try {
            return execute();
        } catch (DcaException e) {
            log.warn("event=dca_run pair={} outcome=failed kind={} message={}", settings.pair().name(), e.getKind(), e.getMessage());
            return DcaRunResult.failed(e);
        }
    }

    private DcaRunResult execute() {
        TradingPair pair = settings.pair();
        Instant now = checkClock();
        checkBalance();

        int windowOrders = countWindowOrders(now);
        if (windowOrders > 0) {
            log.info("event=dca_run pair={} outcome=already_ordered window_orders={}", pair.name(), windowOrders);
            return DcaRunResult.alreadyOrdered(windowOrders);
        }

        BigDecimal askPrice = exchangeGateway.getAskPrice(pair.name());
        log.info("event=dca_ask_price pair={} ask_price={}", pair.name(), plain(askPrice));

        DcaOrder order = orderFactory.buyLimit(now, pair, settings.quoteAmount(), askPrice, settings.takerFeeRate());
        orderFactory.validate(order, pair);
        log.info(
                "event=dca_order_built pair={} volume={} {} limit_price={} {} fee={} total_price={}",
                pair.name(),
                plain(order.volume()),
                pair.base(),
                plain(order.limitPrice()),
                pair.quote(),
                plain(order.fee()),
                plain(order.totalPrice())
        );

        DcaOrder submitted = submit(order);
        log.info("event=dca_order_submitted pair={} txid={} description={}", pair.name(), submitted.exchangeOrderId(), submitted.exchangeDescription());

        try {
            orderHistory.append(submitted);
        } catch (RuntimeException e) {
            OrderPersistenceException failure = new OrderPersistenceException(submitted, e);
            log.error("event=dca_run pair={} outcome=failed kind={} txid={} message={}", pair.name(), failure.getKind(), submitted.exchangeOrderId(), failure.getMessage(), e);
            return DcaRunResult.failed(failure, submitted);
        }
        return DcaRunResult.placed(submitted);
    }

    /**
     * Fails when the system clock drifts from the exchange clock by more than the tolerance.
     * The exchange reports whole seconds, so the local time is compared at second precision.
     *
     * @return the local time used as the decision timestamp
     */
    Instant checkClock() {
        Instant exchangeTime = exchangeGateway.getServerTime();
        if (exchangeTime == null) {
            throw new ExchangeApiException("Exchange returned no server time");
        }
        Instant now = clock.instant();
        log.info("event=dca_clock exchange_time={} system_time={}", exchangeTime, now);

        Duration lag = Duration.between(exchangeTime, now.truncatedTo(ChronoUnit.SECONDS)).abs();
        if (lag.compareTo(settings.clockTolerance()) > 0) {
            throw new ClockSkewException(exchangeTime, now, settings.clockTolerance());
        }
        return now;
    }

    void checkBalance() {
        TradingPair pair = settings.pair();
        TradeBalance tradeBalance = exchangeGateway.getTradeBalance();
        if (tradeBalance != null) {
            log.info("event=dca_trade_balance equivalent_balance={}", plain(tradeBalance.equivalentBalance()));
        }

        Map<String, BigDecimal> balances = exchangeGateway.getBalance();
        BigDecimal baseBalance = balanceOf(balances, pair.base());
        BigDecimal quoteBalance = balanceOf(balances, pair.quote());
        log.info(
                "event=dca_pair_balance quote={} {} base={} {}",
                plain(quoteBalance),
                pair.quote(),
                plain(baseBalance),
                pair.base()
        );

        if (quoteBalance.compareTo(settings.quoteAmount()) < 0) {
            throw new InsufficientFundsException(pair.quote(), settings.quoteAmount(), quoteBalance);
        }
    }

    int countWindowOrders(Instant now) {
        Instant windowStart = windowStart(now, settings.recurrenceDays());
        int openOrders = countPairOrders(exchangeGateway.getOpenOrders());
        int closedOrders = countPairOrders(exchangeGateway.getClosedOrders(windowStart, CloseTimeFilter.OPEN));
        log.debug("event=dca_window window_start={} open_orders={} closed_orders={}", windowStart, openOrders, closedOrders);
        return openOrders + closedOrders;
    }

    /**
     * Start of the averaging window: midnight UTC of the current day, moved back by
     * {@code recurrenceDays - 1} days.
     */
    public static Instant windowStart(Instant now, int recurrenceDays) {
        return now.truncatedTo(ChronoUnit.DAYS).minus(recurrenceDays - 1L, ChronoUnit.DAYS);
    }

    private int countPairOrders(Map<String, ExchangeOrderSummary> orders) {
        if (orders == null) {
            return 0;
        }
        TradingPair pair = settings.pair();
        return (int) orders.values().stream()
                .filter(order -> order != null && pair.matches(order.pair()))
                .count();
    }

    private DcaOrder submit(DcaOrder order) {
        SubmittedOrder submitted;
        try {
            submitted = exchangeGateway.submitLimitBuy(order.pair(), order.volume(), order.limitPrice());
        } catch (OrderSubmissionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OrderSubmissionException("Failed to submit buy limit order for " + order.pair() + ": " + e.getMessage(), e);
        }

        if (submitted == null || submitted.transactionIds() == null || submitted.transactionIds().isEmpty()) {
            throw new OrderSubmissionException("Exchange returned no transaction id for " + order.pair(), null);
        }
        return order.withSubmission(submitted.orderId(), submitted.description());
    }

    private BigDecimal balanceOf(Map<String, BigDecimal> balances, String currency) {
        if (balances == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal balance = balances.get(currency);
        return balance == null ? BigDecimal.ZERO : balance;
    }

    private String plain(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros().toPlainString();
    }
}
