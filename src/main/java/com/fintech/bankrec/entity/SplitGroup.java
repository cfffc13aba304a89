package com.fintech.bankrec.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A set of receipts (or transactions) whose amounts sum to the single counterpart
 * they jointly satisfy. Members are kept in descending-amount order, which puts the
 * primary (usually cash) portion first.
 */
@Entity
@Table(name = "split_groups")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SplitGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "split_group_id")
    private Long splitGroupId;

    @Enumerated(EnumType.STRING)
    @Column(name = "member_type", nullable = false, length = 30)
    private SplitMemberType memberType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "split_group_members", joinColumns = @JoinColumn(name = "split_group_id"))
    @OrderColumn(name = "member_position")
    @Column(name = "member_id", nullable = false)
    @Builder.Default
    private List<Long> memberIds = new ArrayList<>();

    /**
     * Id of the counterpart the group satisfies: a transaction for receipt groups,
     * a receipt for transaction groups.
     */
    @Column(name = "anchor_id", nullable = false)
    private Long anchorId;

    @Column(name = "expected_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal expectedTotal;

    @Column(name = "run_id", length = 64)
    private String runId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
