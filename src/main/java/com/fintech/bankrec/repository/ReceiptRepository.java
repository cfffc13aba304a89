package com.fintech.bankrec.repository;

import com.fintech.bankrec.entity.Receipt;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for receipts with the queries the reconciliation run needs.
 */
@Repository
public interface ReceiptRepository extends JpaRepository<Receipt, Long> {

    /**
     * Receipts that are neither linked to a transaction nor part of a split group,
     * oldest first. Page size bounds the run.
     */
    @Query("SELECT r FROM Receipt r WHERE r.bankingTransactionId IS NULL " +
            "AND r.splitGroupId IS NULL ORDER BY r.receiptDate ASC, r.receiptId ASC")
    Page<Receipt> findUnmatched(Pageable pageable);

    long countByBankingTransactionIdIsNullAndSplitGroupIdIsNull();

    long countByBankingTransactionIdIsNotNull();

    /**
     * Natural-key existence predicate used by the importer.
     */
    @Query("SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END FROM Receipt r " +
            "WHERE UPPER(TRIM(COALESCE(r.vendorNameRaw, ''))) = :vendorKey " +
            "AND r.amount = :amount AND r.receiptDate = :receiptDate")
    boolean existsByNaturalKey(@Param("vendorKey") String vendorKey,
                               @Param("amount") BigDecimal amount,
                               @Param("receiptDate") LocalDate receiptDate);

    boolean existsByImportKey(String importKey);

    /**
     * Other receipts carrying the same amount and vendor, linked or not. These are the
     * peers the duplicate classifier compares against.
     */
    @Query("SELECT r FROM Receipt r WHERE r.amount = :amount " +
            "AND UPPER(TRIM(COALESCE(NULLIF(TRIM(r.canonicalVendor), ''), r.vendorNameRaw))) = :vendorKey " +
            "AND r.receiptId <> :excludeId ORDER BY r.receiptId ASC")
    List<Receipt> findDuplicatePeers(@Param("amount") BigDecimal amount,
                                     @Param("vendorKey") String vendorKey,
                                     @Param("excludeId") Long excludeId);

    /**
     * Same-vendor history, used to look for fee reversals.
     */
    @Query("SELECT r FROM Receipt r WHERE " +
            "UPPER(TRIM(COALESCE(NULLIF(TRIM(r.canonicalVendor), ''), r.vendorNameRaw))) = :vendorKey " +
            "ORDER BY r.receiptDate ASC, r.receiptId ASC")
    List<Receipt> findByVendorKey(@Param("vendorKey") String vendorKey);

    List<Receipt> findBySplitGroupIdOrderByReceiptIdAsc(Long splitGroupId);

    List<Receipt> findByBankingTransactionId(Long bankingTransactionId);

    /**
     * Row lock taken while a link is applied, so a concurrent run cannot link the
     * same receipt.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Receipt r WHERE r.receiptId = :receiptId")
    Optional<Receipt> findByIdForUpdate(@Param("receiptId") Long receiptId);
}
