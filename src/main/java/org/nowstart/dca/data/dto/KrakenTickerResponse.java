package org.nowstart.dca.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Ticker entry. {@code a} is the ask as [price, whole lot volume, lot volume].
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenTickerResponse(
        List<String> a,
        List<String> b,
        List<String> c
) {
}
