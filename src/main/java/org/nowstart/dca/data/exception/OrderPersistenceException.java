package org.nowstart.dca.data.exception;

import lombok.Getter;
import org.nowstart.dca.data.type.DcaErrorKind;
import org.nowstart.dca.service.dca.core.DcaOrder;
import org.springframework.http.HttpStatus;

/**
 * The exchange accepted the order but it could not be written to the order history.
 */
@Getter
public class OrderPersistenceException extends DcaException {

    private final DcaOrder order;

    public OrderPersistenceException(DcaOrder order, Throwable cause) {
        super(
                HttpStatus.INTERNAL_SERVER_ERROR,
                DcaErrorKind.PERSISTENCE,
                "Order " + order.exchangeOrderId() + " for " + order.pair()
                        + " was accepted by the exchange but could not be recorded: " + cause.getMessage(),
                cause
        );
        this.order = order;
    }
}
