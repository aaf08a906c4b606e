package org.nowstart.dca.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenAssetPairResponse(
        String altname,
        String wsname,
        String base,
        String quote,
        Integer pair_decimals,
        Integer lot_decimals,
        String ordermin
) {
}
