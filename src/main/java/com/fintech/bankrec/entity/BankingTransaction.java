package com.fintech.bankrec.entity;

import com.fintech.bankrec.value.Money;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A bank-statement line item.
 * <p>
 * At most one of debit/credit is non-zero. The line is linked either to a single
 * receipt ({@code matchedReceiptId}) or to a split group ({@code matchedSplitGroupId}),
 * never both.
 */
@Entity
@Table(name = "banking_transactions", indexes = {
        @Index(name = "idx_banking_matched_receipt", columnList = "matched_receipt_id"),
        @Index(name = "idx_banking_matched_split", columnList = "matched_split_group_id"),
        @Index(name = "idx_banking_date", columnList = "transaction_date"),
        @Index(name = "idx_banking_import_key", columnList = "import_key", unique = true)
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BankingTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "transaction_id")
    private Long transactionId;

    @Column(name = "account_id", nullable = false, length = 50)
    private String accountId;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(name = "debit_amount", nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal debitAmount = BigDecimal.ZERO;

    @Column(name = "credit_amount", nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal creditAmount = BigDecimal.ZERO;

    @Column(length = 500)
    private String description;

    @Column(name = "matched_receipt_id")
    private Long matchedReceiptId;

    @Column(name = "matched_split_group_id")
    private Long matchedSplitGroupId;

    @Column(name = "import_key", length = 128)
    private String importKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isLinked() {
        return matchedReceiptId != null || matchedSplitGroupId != null;
    }

    /**
     * Signed amount in receipt convention: debits positive, credits negative.
     */
    public Money signedAmount() {
        Money debit = Money.orZero(debitAmount);
        if (!debit.isZero()) {
            return debit;
        }
        return Money.orZero(creditAmount).negate();
    }
}
