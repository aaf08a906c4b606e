package org.nowstart.dca.service.exchange;

public record ExchangeOrderSummary(
        String orderId,
        String pair,
        String status,
        String description
) {
}
