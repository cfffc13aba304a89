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
 * An expense or vendor receipt.
 * <p>
 * A receipt with {@code bankingTransactionId} set is matched. {@code importKey} is only
 * populated for rows created by a bulk import and carries the unique backstop that
 * stops two overlapping imports from inserting the same row.
 */
@Entity
@Table(name = "receipts", indexes = {
        @Index(name = "idx_receipts_banking_tx", columnList = "banking_transaction_id"),
        @Index(name = "idx_receipts_split_group", columnList = "split_group_id"),
        @Index(name = "idx_receipts_natural_key", columnList = "receipt_date, amount"),
        @Index(name = "idx_receipts_import_key", columnList = "import_key", unique = true)
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Receipt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "receipt_id")
    private Long receiptId;

    @Column(name = "vendor_name_raw", length = 200)
    private String vendorNameRaw;

    @Column(name = "canonical_vendor", length = 200)
    private String canonicalVendor;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "receipt_date", nullable = false)
    private LocalDate receiptDate;

    @Column(length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    @Builder.Default
    private PaymentMethod paymentMethod = PaymentMethod.UNKNOWN;

    @Column(name = "source_reference", length = 200)
    private String sourceReference;

    @Column(name = "gl_account", length = 50)
    private String glAccount;

    @Column(name = "vehicle_id", length = 50)
    private String vehicleId;

    @Column(name = "employee_id", length = 50)
    private String employeeId;

    @Column(name = "reserve_number", length = 50)
    private String reserveNumber;

    @Column(name = "split_group_id")
    private Long splitGroupId;

    @Column(name = "banking_transaction_id")
    private Long bankingTransactionId;

    @Column(name = "created_from_banking", nullable = false)
    @Builder.Default
    private boolean createdFromBanking = false;

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

    public boolean isMatched() {
        return bankingTransactionId != null;
    }

    public Money amountAsMoney() {
        return Money.of(amount);
    }

    /**
     * The vendor used for matching: canonical when resolved, raw otherwise.
     */
    public String effectiveVendor() {
        if (canonicalVendor != null && !canonicalVendor.isBlank()) {
            return canonicalVendor;
        }
        return vendorNameRaw;
    }
}
