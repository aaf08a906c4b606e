package org.nowstart.dca.data.type;

public enum DcaErrorKind {
    CLOCK_SKEW,
    INSUFFICIENT_FUNDS,
    ORDER_TOO_SMALL,
    SUBMISSION,
    EXCHANGE_ERROR,
    PERSISTENCE,
    INTERNAL
}
