package com.fintech.bankrec.service.split;

import com.fintech.bankrec.entity.BankingTransaction;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.value.Money;
import lombok.Value;

/**
 * A receipt or transaction offered to the resolver as a possible split member.
 */
@Value(staticConstructor = "of")
public class SplitCandidate {

    Long id;
    Money amount;

    public static SplitCandidate fromReceipt(Receipt receipt) {
        return of(receipt.getReceiptId(), receipt.amountAsMoney());
    }

    public static SplitCandidate fromTransaction(BankingTransaction transaction) {
        return of(transaction.getTransactionId(), transaction.signedAmount());
    }
}
