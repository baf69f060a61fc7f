package com.fitcycle.backend.progress.repo;

import com.fitcycle.backend.progress.entity.BodyProgressLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface BodyProgressLogRepo extends JpaRepository<BodyProgressLog, Long> {

    Optional<BodyProgressLog> findByIdAndUserId(Long id, Long userId);

    @Query("""
           select p from BodyProgressLog p
           where p.userId = :uid
           order by p.logDate desc, p.id desc
           """)
    List<BodyProgressLog> findLatest(@Param("uid") Long uid, Pageable pageable);

    @Query("""
           select p from BodyProgressLog p
           where p.userId = :uid and p.logDate between :from and :to
           order by p.logDate asc, p.id asc
           """)
    List<BodyProgressLog> findInRange(@Param("uid") Long uid,
                                      @Param("from") LocalDate from,
                                      @Param("to") LocalDate to);
}
