package com.fitcycle.backend.daystatus.repo;

import com.fitcycle.backend.daystatus.entity.CalendarDay;
import com.fitcycle.backend.daystatus.model.DayStatus;
import com.fitcycle.backend.plan.model.DayType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface CalendarDayRepository extends JpaRepository<CalendarDay, Long> {

    Optional<CalendarDay> findByUserIdAndDayDate(Long userId, LocalDate dayDate);

    List<CalendarDay> findByUserIdAndDayDateBetweenOrderByDayDateAsc(Long userId, LocalDate from, LocalDate to);

    /** before 之前還停在 from 狀態、且是 dayType 的日子一次改成 to */
    @Modifying
    @Transactional
    @Query("""
           update CalendarDay d
              set d.status = :to, d.updatedAt = :now
            where d.userId = :uid
              and d.dayDate < :before
              and d.dayType = :dayType
              and d.status = :from
           """)
    int transitionBefore(@Param("uid") Long uid,
                         @Param("before") LocalDate before,
                         @Param("dayType") DayType dayType,
                         @Param("from") DayStatus from,
                         @Param("to") DayStatus to,
                         @Param("now") Instant now);
}
