package org.nowstart.dca.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenTradeBalanceResponse(
        String eb,
        String tb,
        String m,
        String n,
        String c,
        String v,
        String e,
        String mf
) {
}
