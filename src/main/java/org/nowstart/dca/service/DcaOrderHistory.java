package org.nowstart.dca.service;

import java.util.List;
import org.nowstart.dca.service.dca.core.DcaOrder;

/**
 * Append-only store of orders accepted by the exchange.
 */
public interface DcaOrderHistory {

    void append(DcaOrder order);

    List<DcaOrder> findAll();
}
