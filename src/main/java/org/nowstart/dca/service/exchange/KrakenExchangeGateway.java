package org.nowstart.dca.service.exchange;

import feign.FeignException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.dca.data.dto.KrakenAddOrderResponse;
import org.nowstart.dca.data.dto.KrakenAssetPairResponse;
import org.nowstart.dca.data.dto.KrakenClosedOrdersResponse;
import org.nowstart.dca.data.dto.KrakenOpenOrdersResponse;
import org.nowstart.dca.data.dto.KrakenOrderResponse;
import org.nowstart.dca.data.dto.KrakenResponse;
import org.nowstart.dca.data.dto.KrakenTickerResponse;
import org.nowstart.dca.data.dto.KrakenTimeResponse;
import org.nowstart.dca.data.dto.KrakenTradeBalanceResponse;
import org.nowstart.dca.data.exception.ExchangeApiException;
import org.nowstart.dca.data.exception.OrderSubmissionException;
import org.nowstart.dca.repository.KrakenPrivateFeignClient;
import org.nowstart.dca.repository.KrakenPublicFeignClient;
import org.nowstart.dca.service.dca.core.TradingPair;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class KrakenExchangeGateway implements ExchangeGateway {

    private final KrakenPublicFeignClient krakenPublicFeignClient;
    private final KrakenPrivateFeignClient krakenPrivateFeignClient;

    @Override
    public Instant getServerTime() {
        KrakenTimeResponse time = call("Time", krakenPublicFeignClient::getTime);
        return Instant.ofEpochSecond(time.unixtime());
    }

    @Override
    public TradeBalance getTradeBalance() {
        KrakenTradeBalanceResponse balance = call("TradeBalance", () -> krakenPrivateFeignClient.getTradeBalance(Map.of()));
        return new TradeBalance(parseDecimal(balance.eb()), parseDecimal(balance.tb()));
    }

    @Override
    public Map<String, BigDecimal> getBalance() {
        Map<String, String> balances = call("Balance", () -> krakenPrivateFeignClient.getBalance(Map.of()));
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        balances.forEach((currency, amount) -> result.put(currency, parseDecimal(amount)));
        return result;
    }

    @Override
    public Map<String, ExchangeOrderSummary> getOpenOrders() {
        KrakenOpenOrdersResponse response = call("OpenOrders", () -> krakenPrivateFeignClient.getOpenOrders(Map.of()));
        return toSummaries(response.open());
    }

    /**
     * Collects every closed order page. Kraken returns at most 50 orders per call together with the total count.
     */
    @Override
    public Map<String, ExchangeOrderSummary> getClosedOrders(Instant start, CloseTimeFilter closeTime) {
        Map<String, ExchangeOrderSummary> result = new LinkedHashMap<>();
        int offset = 0;
        while (true) {
            Map<String, Object> form = new LinkedHashMap<>();
            form.put("start", start.getEpochSecond());
            form.put("closetime", closeTime.value());
            if (offset > 0) {
                form.put("ofs", offset);
            }

            KrakenClosedOrdersResponse page = call("ClosedOrders", () -> krakenPrivateFeignClient.getClosedOrders(form));
            Map<String, KrakenOrderResponse> closed = page.closed() == null ? Map.of() : page.closed();
            result.putAll(toSummaries(closed));
            offset += closed.size();

            if (closed.isEmpty() || offset >= page.count()) {
                return result;
            }
        }
    }

    @Override
    public BigDecimal getAskPrice(String pair) {
        Map<String, KrakenTickerResponse> tickers = call("Ticker", () -> krakenPublicFeignClient.getTicker(pair));
        KrakenTickerResponse ticker = tickers.containsKey(pair)
                ? tickers.get(pair)
                : tickers.values().stream().findFirst().orElse(null);
        if (ticker == null || ticker.a() == null || ticker.a().isEmpty()) {
            throw new ExchangeApiException("Kraken Ticker returned no ask price for " + pair);
        }
        return new BigDecimal(ticker.a().get(0));
    }

    @Override
    public SubmittedOrder submitLimitBuy(String pair, BigDecimal volume, BigDecimal limitPrice) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("ordertype", "limit");
        form.put("pair", pair);
        form.put("price", limitPrice.toPlainString());
        form.put("type", "buy");
        form.put("volume", volume.toPlainString());

        KrakenAddOrderResponse response;
        try {
            response = call("AddOrder", () -> krakenPrivateFeignClient.addOrder(form));
        } catch (ExchangeApiException e) {
            throw new OrderSubmissionException("Kraken rejected buy limit order for " + pair + ": " + e.getMessage(), e);
        }

        List<String> txid = response.txid() == null ? List.of() : response.txid();
        String description = response.descr() == null ? null : response.descr().order();
        return new SubmittedOrder(txid, description);
    }

    @Override
    public TradingPair getTradingPair(String pair) {
        Map<String, KrakenAssetPairResponse> pairs = call("AssetPairs", () -> krakenPublicFeignClient.getAssetPairs(pair));
        Map.Entry<String, KrakenAssetPairResponse> entry = pairs.entrySet().stream()
                .findFirst()
                .orElseThrow(() -> new ExchangeApiException("Kraken AssetPairs returned no pair for " + pair));

        KrakenAssetPairResponse info = entry.getValue();
        if (info.lot_decimals() == null || info.pair_decimals() == null || info.ordermin() == null) {
            throw new ExchangeApiException("Kraken AssetPairs returned incomplete pair information for " + pair);
        }
        return new TradingPair(
                entry.getKey(),
                info.altname(),
                info.base(),
                info.quote(),
                info.lot_decimals(),
                info.pair_decimals(),
                new BigDecimal(info.ordermin())
        );
    }

    private <T> T call(String operation, Supplier<KrakenResponse<T>> request) {
        KrakenResponse<T> response;
        try {
            response = request.get();
        } catch (FeignException e) {
            throw new ExchangeApiException("Kraken " + operation + " request failed with status " + e.status(), e);
        } catch (RuntimeException e) {
            throw new ExchangeApiException("Kraken " + operation + " request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ExchangeApiException("Kraken " + operation + " returned an empty response");
        }

        List<String> errors = response.error() == null ? List.of() : response.error();
        List<String> failures = errors.stream()
                .filter(error -> !error.startsWith("W"))
                .toList();
        if (!failures.isEmpty()) {
            throw new ExchangeApiException("Kraken " + operation + " failed: " + String.join(", ", failures), failures);
        }
        if (!errors.isEmpty()) {
            log.warn("event=kraken_warning operation={} warnings={}", operation, errors);
        }

        if (response.result() == null) {
            throw new ExchangeApiException("Kraken " + operation + " returned no result");
        }
        return response.result();
    }

    private Map<String, ExchangeOrderSummary> toSummaries(Map<String, KrakenOrderResponse> orders) {
        Map<String, ExchangeOrderSummary> summaries = new LinkedHashMap<>();
        if (orders == null) {
            return summaries;
        }
        orders.forEach((orderId, order) -> summaries.put(orderId, new ExchangeOrderSummary(
                orderId,
                order.descr() == null ? null : order.descr().pair(),
                order.status(),
                order.descr() == null ? null : order.descr().order()
        )));
        return summaries;
    }

    private BigDecimal parseDecimal(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value);
    }
}
