package org.nowstart.dca.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenClosedOrdersResponse(
        Map<String, KrakenOrderResponse> closed,
        int count
) {
}
