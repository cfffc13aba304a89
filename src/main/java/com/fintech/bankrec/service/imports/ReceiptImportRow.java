package com.fintech.bankrec.service.imports;

import com.fintech.bankrec.entity.PaymentMethod;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * A receipt line: {@code date, vendor, amount, description, glAccount} plus the optional
 * columns, which are only written when the target schema defines them.
 */
@Value
@Builder
public class ReceiptImportRow implements ImportRow {

    int rowIndex;
    LocalDate date;
    String vendor;
    BigDecimal amount;
    String description;
    String glAccount;

    @Builder.Default
    PaymentMethod paymentMethod = PaymentMethod.UNKNOWN;

    @Getter(AccessLevel.NONE)
    String vehicleId;

    @Getter(AccessLevel.NONE)
    String employeeId;

    @Getter(AccessLevel.NONE)
    String reserveNumber;

    @Getter(AccessLevel.NONE)
    String sourceReference;

    public Optional<String> vehicleId() {
        return present(vehicleId);
    }

    public Optional<String> employeeId() {
        return present(employeeId);
    }

    public Optional<String> reserveNumber() {
        return present(reserveNumber);
    }

    public Optional<String> sourceReference() {
        return present(sourceReference);
    }

    private static Optional<String> present(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
