package org.nowstart.dca.service;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.dca.data.entity.DcaOrderRecord;
import org.nowstart.dca.repository.DcaOrderRecordRepository;
import org.nowstart.dca.service.dca.core.DcaOrder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DcaOrderHistoryService implements DcaOrderHistory {

    private final DcaOrderRecordRepository dcaOrderRecordRepository;

    @Override
    @Transactional
    public void append(DcaOrder order) {
        if (!order.submitted()) {
            throw new IllegalArgumentException("Only submitted orders can be recorded");
        }
        dcaOrderRecordRepository.save(toRecord(order));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DcaOrder> findAll() {
        return dcaOrderRecordRepository.findAllByOrderByOrderedAtAsc().stream()
                .map(this::toOrder)
                .toList();
    }

    private DcaOrderRecord toRecord(DcaOrder order) {
        return DcaOrderRecord.builder()
                .orderedAt(order.timestamp())
                .pair(order.pair())
                .orderType(order.type())
                .quoteAmount(order.quoteAmount())
                .askPrice(order.askPrice())
                .volume(order.volume())
                .limitPrice(order.limitPrice())
                .fee(order.fee())
                .totalPrice(order.totalPrice())
                .exchangeOrderId(order.exchangeOrderId())
                .exchangeDescription(order.exchangeDescription())
                .build();
    }

    private DcaOrder toOrder(DcaOrderRecord record) {
        return new DcaOrder(
                record.getOrderedAt(),
                record.getPair(),
                record.getOrderType(),
                record.getQuoteAmount(),
                record.getAskPrice(),
                record.getVolume(),
                record.getLimitPrice(),
                record.getFee(),
                record.getTotalPrice(),
                record.getExchangeOrderId(),
                record.getExchangeDescription()
        );
    }
}
