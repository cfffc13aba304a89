package com.fintech.bankrec.service;

import com.fintech.bankrec.dto.LinkNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Reports links once their run has committed. Rolled-back runs publish nothing.
 */
@Component
@Slf4j
public class LinkNotificationListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onLink(LinkNotification notification) {
        if (notification.getSplitGroupId() != null) {
            log.info("Matched split group {} to transaction {} ({}, confidence {})",
                    notification.getSplitGroupId(), notification.getTransactionId(),
                    notification.getRuleApplied(), String.format("%.2f", notification.getConfidence()));
        } else {
            log.info("Matched receipt {} to transaction {} ({}, confidence {})",
                    notification.getReceiptId(), notification.getTransactionId(),
                    notification.getRuleApplied(), String.format("%.2f", notification.getConfidence()));
        }
    }
}
