package org.nowstart.dca.repository;

import java.util.Map;
import org.nowstart.dca.data.dto.KrakenAssetPairResponse;
import org.nowstart.dca.data.dto.KrakenResponse;
import org.nowstart.dca.data.dto.KrakenTickerResponse;
import org.nowstart.dca.data.dto.KrakenTimeResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "krakenPublicClient",
        url = "${dca.base-url:https://api.kraken.com}"
)
public interface KrakenPublicFeignClient {

    @GetMapping("/0/public/Time")
    KrakenResponse<KrakenTimeResponse> getTime();

    @GetMapping("/0/public/AssetPairs")
    KrakenResponse<Map<String, KrakenAssetPairResponse>> getAssetPairs(@RequestParam("pair") String pair);

    @GetMapping("/0/public/Ticker")
    KrakenResponse<Map<String, KrakenTickerResponse>> getTicker(@RequestParam("pair") String pair);
}
