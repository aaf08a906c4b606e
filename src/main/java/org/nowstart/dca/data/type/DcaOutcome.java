package org.nowstart.dca.data.type;

public enum DcaOutcome {
    ORDER_PLACED,
    ALREADY_ORDERED,
    FAILED
}
