package org.nowstart.dca.data.exception;

import org.nowstart.dca.data.type.DcaErrorKind;
import org.springframework.http.HttpStatus;

public class OrderSubmissionException extends DcaException {

    public OrderSubmissionException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, DcaErrorKind.SUBMISSION, message, cause);
    }
}
