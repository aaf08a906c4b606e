package org.nowstart.dca.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenOrderResponse(
        String refid,
        String status,
        Double opentm,
        Double closetm,
        String vol,
        String vol_exec,
        String cost,
        String fee,
        String price,
        OrderDescription descr
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrderDescription(
            String pair,
            String type,
            String ordertype,
            String price,
            String order
    ) {
    }
}
