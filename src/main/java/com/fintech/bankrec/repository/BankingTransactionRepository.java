package com.fintech.bankrec.repository;

import com.fintech.bankrec.entity.BankingTransaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for bank statement lines.
 */
@Repository
public interface BankingTransactionRepository extends JpaRepository<BankingTransaction, Long> {

    @Query("SELECT t FROM BankingTransaction t WHERE t.matchedReceiptId IS NULL " +
            "AND t.matchedSplitGroupId IS NULL ORDER BY t.transactionDate ASC, t.transactionId ASC")
    Page<BankingTransaction> findUnmatched(Pageable pageable);

    long countByMatchedReceiptIdIsNullAndMatchedSplitGroupIdIsNull();

    boolean existsByImportKey(String importKey);

    /**
     * Every line in a date range, linked or not. Used by re-match maintenance.
     */
    @Query("SELECT t FROM BankingTransaction t WHERE t.transactionDate BETWEEN :from AND :to " +
            "ORDER BY t.transactionDate ASC, t.transactionId ASC")
    List<BankingTransaction> findByDateRange(@Param("from") LocalDate from, @Param("to") LocalDate to);

    Optional<BankingTransaction> findByMatchedReceiptId(Long matchedReceiptId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM BankingTransaction t WHERE t.transactionId = :transactionId")
    Optional<BankingTransaction> findByIdForUpdate(@Param("transactionId") Long transactionId);
}
