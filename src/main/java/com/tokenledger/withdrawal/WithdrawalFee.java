package com.tokenledger.withdrawal;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Network fee charged on top of every withdrawal. There is only ever one row.
 */
@Entity
@Table(name = "withdrawal_fee")
@Data
@NoArgsConstructor
public class WithdrawalFee {

    static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "fee", precision = 24, scale = 6, nullable = false)
    private BigDecimal fee;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public WithdrawalFee(BigDecimal fee) {
        this.id = SINGLETON_ID;
        this.fee = fee;
        this.updatedAt = Instant.now();
    }
}
