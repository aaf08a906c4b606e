package org.nowstart.dca.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.nowstart.dca.data.type.DcaOrderType;

@Entity
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "dca_order")
public class DcaOrderRecord extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Instant orderedAt;

    @Column(nullable = false)
    private String pair;

    @Enumerated(EnumType.STRING)
    private DcaOrderType orderType;

    @Column(precision = 38, scale = 18)
    private BigDecimal quoteAmount;

    @Column(precision = 38, scale = 18)
    private BigDecimal askPrice;

    @Column(precision = 38, scale = 18)
    private BigDecimal volume;

    @Column(precision = 38, scale = 18)
    private BigDecimal limitPrice;

    @Column(precision = 38, scale = 18)
    private BigDecimal fee;

    @Column(precision = 38, scale = 18)
    private BigDecimal totalPrice;

    @Column(nullable = false)
    private String exchangeOrderId;

    private String exchangeDescription;
}
