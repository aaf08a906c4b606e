package org.nowstart.dca.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.dca.data.exception.ExchangeApiException;
import org.nowstart.dca.data.exception.OrderTooSmallException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

class DcaExceptionHandlerTest {

    private final DcaExceptionHandler handler = new DcaExceptionHandler();

    @Test
    void handleDcaException_returnsProblemDetailWithKind() {
        OrderTooSmallException exception = new OrderTooSmallException("XXBT", new BigDecimal("0.00"), new BigDecimal("0.01"));

        ProblemDetail detail = handler.handleDcaException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY.value());
        assertThat(detail.getDetail()).isEqualTo("Too low volume to buy XXBT: current 0.00, minimum 0.01");
        assertThat(detail.getProperties())
                .containsEntry("code", "order_too_small")
                .containsEntry("kind", "ORDER_TOO_SMALL");
    }

    @Test
    void handleDcaException_mapsExchangeErrorToBadGateway() {
        ProblemDetail detail = handler.handleDcaException(new ExchangeApiException("Kraken Balance failed: EAPI:Invalid key", List.of("EAPI:Invalid key")));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY.value());
        assertThat(detail.getProperties()).containsEntry("code", "exchange_error");
    }

    @Test
    void handleUnexpectedException_returnsInternalErrorProblemDetail() {
        ProblemDetail detail = handler.handleUnexpectedException();

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(detail.getDetail()).isEqualTo("Unexpected server error");
        assertThat(detail.getProperties()).containsEntry("code", "internal_error");
    }
}
