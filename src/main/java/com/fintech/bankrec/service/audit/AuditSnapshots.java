package com.fintech.bankrec.service.audit;

import com.fintech.bankrec.entity.BankingTransaction;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.entity.SplitGroup;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat, detached views of entities for audit before/after snapshots.
 */
public final class AuditSnapshots {

    private AuditSnapshots() {
    }

    public static Map<String, Object> of(Receipt receipt) {
        if (receipt == null) {
            return null;
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("receiptId", receipt.getReceiptId());
        snapshot.put("vendorNameRaw", receipt.getVendorNameRaw());
        snapshot.put("canonicalVendor", receipt.getCanonicalVendor());
        snapshot.put("amount", receipt.getAmount());
        snapshot.put("receiptDate", receipt.getReceiptDate());
        snapshot.put("description", receipt.getDescription());
        snapshot.put("paymentMethod", receipt.getPaymentMethod());
        snapshot.put("sourceReference", receipt.getSourceReference());
        snapshot.put("glAccount", receipt.getGlAccount());
        snapshot.put("vehicleId", receipt.getVehicleId());
        snapshot.put("employeeId", receipt.getEmployeeId());
        snapshot.put("reserveNumber", receipt.getReserveNumber());
        snapshot.put("splitGroupId", receipt.getSplitGroupId());
        snapshot.put("bankingTransactionId", receipt.getBankingTransactionId());
        snapshot.put("createdFromBanking", receipt.isCreatedFromBanking());
        return snapshot;
    }

    public static Map<String, Object> of(BankingTransaction transaction) {
        if (transaction == null) {
            return null;
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("transactionId", transaction.getTransactionId());
        snapshot.put("accountId", transaction.getAccountId());
        snapshot.put("transactionDate", transaction.getTransactionDate());
        snapshot.put("debitAmount", transaction.getDebitAmount());
        snapshot.put("creditAmount", transaction.getCreditAmount());
        snapshot.put("description", transaction.getDescription());
        snapshot.put("matchedReceiptId", transaction.getMatchedReceiptId());
        snapshot.put("matchedSplitGroupId", transaction.getMatchedSplitGroupId());
        return snapshot;
    }

    public static Map<String, Object> of(SplitGroup group) {
        if (group == null) {
            return null;
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("splitGroupId", group.getSplitGroupId());
        snapshot.put("memberType", group.getMemberType());
        snapshot.put("memberIds", group.getMemberIds());
        snapshot.put("anchorId", group.getAnchorId());
        snapshot.put("expectedTotal", group.getExpectedTotal());
        return snapshot;
    }
}
