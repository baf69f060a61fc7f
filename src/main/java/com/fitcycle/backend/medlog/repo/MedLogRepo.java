package com.fitcycle.backend.medlog.repo;

import com.fitcycle.backend.medlog.entity.MedLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MedLogRepo extends JpaRepository<MedLog, Long> {

    Optional<MedLog> findByIdAndUserId(Long id, Long userId);

    @Query("""
           select m from MedLog m
           where m.userId = :uid
           order by m.logDate desc, m.id desc
           """)
    List<MedLog> findLatest(@Param("uid") Long uid, Pageable pageable);
}
