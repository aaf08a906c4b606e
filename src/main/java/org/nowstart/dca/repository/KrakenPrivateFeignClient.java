package org.nowstart.dca.repository;

import java.util.Map;
import org.nowstart.dca.config.KrakenFeignConfig;
import org.nowstart.dca.data.dto.KrakenAddOrderResponse;
import org.nowstart.dca.data.dto.KrakenClosedOrdersResponse;
import org.nowstart.dca.data.dto.KrakenOpenOrdersResponse;
import org.nowstart.dca.data.dto.KrakenResponse;
import org.nowstart.dca.data.dto.KrakenTradeBalanceResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Authenticated Kraken endpoints. Every call is a form-encoded POST; the nonce and signature are added by
 * {@link org.nowstart.dca.service.auth.KrakenAuthRequestInterceptor}.
 */
@FeignClient(
        name = "krakenPrivateClient",
        url = "${dca.base-url:https://api.kraken.com}",
        configuration = KrakenFeignConfig.class
)
public interface KrakenPrivateFeignClient {

    @PostMapping(value = "/0/private/Balance", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    KrakenResponse<Map<String, String>> getBalance(@RequestBody Map<String, ?> form);

    @PostMapping(value = "/0/private/TradeBalance", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    KrakenResponse<KrakenTradeBalanceResponse> getTradeBalance(@RequestBody Map<String, ?> form);

    @PostMapping(value = "/0/private/OpenOrders", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    KrakenResponse<KrakenOpenOrdersResponse> getOpenOrders(@RequestBody Map<String, ?> form);

    @PostMapping(value = "/0/private/ClosedOrders", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    KrakenResponse<KrakenClosedOrdersResponse> getClosedOrders(@RequestBody Map<String, ?> form);

    @PostMapping(value = "/0/private/AddOrder", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    KrakenResponse<KrakenAddOrderResponse> addOrder(@RequestBody Map<String, ?> form);
}
