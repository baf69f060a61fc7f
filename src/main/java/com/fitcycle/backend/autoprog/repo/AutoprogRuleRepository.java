package com.fitcycle.backend.autoprog.repo;

import com.fitcycle.backend.autoprog.entity.AutoprogRuleEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface AutoprogRuleRepository extends JpaRepository<AutoprogRuleEntity, Long> {

    List<AutoprogRuleEntity> findByUserIdOrderByIdAsc(Long userId);

    Optional<AutoprogRuleEntity> findByUserIdAndRuleKey(Long userId, String ruleKey);

    Optional<AutoprogRuleEntity> findByIdAndUserId(Long id, Long userId);

    @Query(value = """
           select distinct r.userId
           from AutoprogRuleEntity r
           order by r.userId asc
           """,
           countQuery = "select count(distinct r.userId) from AutoprogRuleEntity r")
    Page<Long> findDistinctUserIds(Pageable pageable);
}
