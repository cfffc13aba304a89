package com.fintech.bankrec.repository;

import com.fintech.bankrec.entity.VendorAlias;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VendorAliasRepository extends JpaRepository<VendorAlias, String> {
}
