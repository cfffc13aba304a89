package com.fintech.bankrec.repository;

import com.fintech.bankrec.entity.SplitGroup;
import com.fintech.bankrec.entity.SplitMemberType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SplitGroupRepository extends JpaRepository<SplitGroup, Long> {

    List<SplitGroup> findByMemberTypeAndAnchorId(SplitMemberType memberType, Long anchorId);
}
