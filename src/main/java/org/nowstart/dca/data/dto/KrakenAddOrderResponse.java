package org.nowstart.dca.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenAddOrderResponse(
        Description descr,
        List<String> txid
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Description(
            String order,
            String close
    ) {
    }
}
