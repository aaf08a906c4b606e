package org.nowstart.dca.data.exception;

import lombok.Getter;
import org.nowstart.dca.data.type.DcaErrorKind;
import org.springframework.http.HttpStatus;

/**
 * Base class of every failure that aborts a DCA invocation.
 */
@Getter
public abstract class DcaException extends RuntimeException {

    private final HttpStatus status;
    private final DcaErrorKind kind;

    protected DcaException(HttpStatus status, DcaErrorKind kind, String message) {
        super(message);
        this.status = status;
        this.kind = kind;
    }

    protected DcaException(HttpStatus status, DcaErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.kind = kind;
    }

    public String getCode() {
        return kind.name().toLowerCase();
    }
}
