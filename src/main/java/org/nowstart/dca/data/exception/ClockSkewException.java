package org.nowstart.dca.data.exception;

import java.time.Duration;
import java.time.Instant;
import lombok.Getter;
import org.nowstart.dca.data.type.DcaErrorKind;
import org.springframework.http.HttpStatus;

@Getter
public class ClockSkewException extends DcaException {

    private final Instant exchangeTime;
    private final Instant localTime;
    private final Duration tolerance;

    public ClockSkewException(Instant exchangeTime, Instant localTime, Duration tolerance) {
        super(
                HttpStatus.CONFLICT,
                DcaErrorKind.CLOCK_SKEW,
                "Too much lag between exchange time " + exchangeTime + " and system time " + localTime
                        + " (tolerance " + tolerance.toMillis() + "ms). Check the internet connection or synchronize the system clock."
        );
        this.exchangeTime = exchangeTime;
        this.localTime = localTime;
        this.tolerance = tolerance;
    }
}
