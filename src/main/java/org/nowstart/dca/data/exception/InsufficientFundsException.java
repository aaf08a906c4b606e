package org.nowstart.dca.data.exception;

import java.math.BigDecimal;
import lombok.Getter;
import org.nowstart.dca.data.type.DcaErrorKind;
import org.springframework.http.HttpStatus;

@Getter
public class InsufficientFundsException extends DcaException {

    private final String currency;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientFundsException(String currency, BigDecimal required, BigDecimal available) {
        super(
                HttpStatus.UNPROCESSABLE_ENTITY,
                DcaErrorKind.INSUFFICIENT_FUNDS,
                "Insufficient funds: required " + required.toPlainString() + " " + currency
                        + ", available " + available.toPlainString() + " " + currency
        );
        this.currency = currency;
        this.required = required;
        this.available = available;
    }

    public BigDecimal getShortfall() {
        return required.subtract(available);
    }
}
