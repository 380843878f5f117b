package com.openforge.promptyoself.repository;

import com.openforge.promptyoself.domain.Reminder;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReminderRepository extends JpaRepository<Reminder, Long> {

    /** Row-locked read used by the per-row patch so concurrent writers serialize. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Reminder r where r.id = :id")
    Optional<Reminder> findByIdForUpdate(@Param("id") Long id);

    /** The due query, served by idx_schedules_due. */
    @Query("select r from Reminder r where r.active = true and r.nextRun <= :now order by r.nextRun asc, r.id asc")
    List<Reminder> findDue(@Param("now") LocalDateTime now);

    @Query("""
            select r from Reminder r
            where (:agentId is null or r.agentId = :agentId)
              and (:activeOnly = false or r.active = true)
            order by r.nextRun asc, r.id asc
            """)
    List<Reminder> search(@Param("agentId") String agentId,
                          @Param("activeOnly") boolean activeOnly,
                          Pageable pageable);

    long countByActiveTrue();

    Optional<Reminder> findFirstByOrderByCreatedAtAsc();

    Optional<Reminder> findFirstByOrderByCreatedAtDesc();

    /** Retention cleanup: inactive rows created before the cutoff. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Reminder r where r.active = false and r.createdAt < :cutoff")
    int deleteInactiveCreatedBefore(@Param("cutoff") LocalDateTime cutoff);
}
