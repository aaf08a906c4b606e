package org.nowstart.dca.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Kraken response envelope. Business failures arrive with HTTP 200 and a non-empty {@code error} list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenResponse<T>(
        List<String> error,
        T result
) {
}
