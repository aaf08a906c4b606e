package org.nowstart.dca.service.exchange;

import java.util.List;

public record SubmittedOrder(
        List<String> transactionIds,
        String description
) {

    public String orderId() {
        return String.join(",", transactionIds);
    }
}
