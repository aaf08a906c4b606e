package org.nowstart.dca.data.exception;

import java.util.List;
import lombok.Getter;
import org.nowstart.dca.data.type.DcaErrorKind;
import org.springframework.http.HttpStatus;

@Getter
public class ExchangeApiException extends DcaException {

    private final List<String> errors;

    public ExchangeApiException(String message) {
        this(message, List.of());
    }

    public ExchangeApiException(String message, List<String> errors) {
        super(HttpStatus.BAD_GATEWAY, DcaErrorKind.EXCHANGE_ERROR, message);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public ExchangeApiException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, DcaErrorKind.EXCHANGE_ERROR, message, cause);
        this.errors = List.of();
    }
}
