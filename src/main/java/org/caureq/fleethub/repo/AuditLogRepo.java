package org.caureq.fleethub.repo;

import org.caureq.fleethub.domain.AuditLog;
import org.caureq.fleethub.domain.AuditStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface AuditLogRepo extends JpaRepository<AuditLog, Long> {

    @Query("""
            select a from AuditLog a
            where (:userId is null or a.userId = :userId)
              and (:agentId is null or a.agentId = :agentId)
              and (:commandType is null or a.commandType = :commandType)
              and (:status is null or a.status = :status)
            order by a.ts desc
            """)
    Page<AuditLog> search(@Param("userId") Long userId,
                          @Param("agentId") String agentId,
                          @Param("commandType") String commandType,
                          @Param("status") AuditStatus status,
                          Pageable pageable);

    long countByTsAfter(Instant since);

    long countByTsAfterAndStatus(Instant since, AuditStatus status);

    /** Rows of [commandType, count] since the given instant. */
    @Query("select a.commandType, count(a) from AuditLog a where a.ts > :since group by a.commandType")
    List<Object[]> countByType(@Param("since") Instant since);

    /** Finalizes a pending row. Returns 0 if it was already terminal. */
    @Modifying
    @Query("""
            update AuditLog a set a.status = :status, a.error = :error, a.durationMs = :durationMs
            where a.id = :id and a.status = org.caureq.fleethub.domain.AuditStatus.PENDING
            """)
    int complete(@Param("id") Long id,
                 @Param("status") AuditStatus status,
                 @Param("error") String error,
                 @Param("durationMs") Long durationMs);

    @Modifying
    @Query("delete from AuditLog a where a.ts < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
