package com.signalbot.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProtectiveFill {

    @Column(name = "order_id", nullable = false)
    private String orderId;

    @Column(name = "filled_quantity", precision = 30, scale = 12)
    private BigDecimal quantity;
}
