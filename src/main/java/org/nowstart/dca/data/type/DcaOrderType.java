package org.nowstart.dca.data.type;

public enum DcaOrderType {
    BUY_LIMIT
}
