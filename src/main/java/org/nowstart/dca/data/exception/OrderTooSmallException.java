package org.nowstart.dca.data.exception;

import java.math.BigDecimal;
import lombok.Getter;
import org.nowstart.dca.data.type.DcaErrorKind;
import org.springframework.http.HttpStatus;

@Getter
public class OrderTooSmallException extends DcaException {

    private final String base;
    private final BigDecimal volume;
    private final BigDecimal orderMin;

    public OrderTooSmallException(String base, BigDecimal volume, BigDecimal orderMin) {
        super(
                HttpStatus.UNPROCESSABLE_ENTITY,
                DcaErrorKind.ORDER_TOO_SMALL,
                "Too low volume to buy " + base + ": current " + volume.toPlainString()
                        + ", minimum " + orderMin.toPlainString()
        );
        this.base = base;
        this.volume = volume;
        this.orderMin = orderMin;
    }
}
