package com.fintech.bankrec.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Read-only vendor canonicalization dictionary, maintained outside this engine.
 * Aliases are stored upper-cased.
 */
@Entity
@Immutable
@Table(name = "vendor_aliases")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VendorAlias {

    @Id
    @Column(length = 200)
    private String alias;

    @Column(name = "canonical_name", nullable = false, length = 200)
    private String canonicalName;
}
