package com.boundplan.repository;

import com.boundplan.entity.BoundPlanSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Repository interface for managing {@link BoundPlanSession} entities, keyed by session id.
 */
public interface BoundPlanSessionRepository extends JpaRepository<BoundPlanSession, String> {

    /**
     * Overwrites the session row only while it is still at {@code expectedRevision}.
     *
     * @return the number of rows updated, 0 when the session is missing or was written in between.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update BoundPlanSession s set s.stateJson = :stateJson, s.boundPlanSpec = :boundPlanSpec, "
            + "s.planReadiness = :planReadiness, s.revision = :nextRevision, s.updatedAt = :updatedAt "
            + "where s.sessionId = :sessionId and s.revision = :expectedRevision")
    int updateIfRevisionMatches(@Param("sessionId") String sessionId,
                                @Param("expectedRevision") long expectedRevision,
                                @Param("nextRevision") long nextRevision,
                                @Param("stateJson") String stateJson,
                                @Param("boundPlanSpec") String boundPlanSpec,
                                @Param("planReadiness") String planReadiness,
                                @Param("updatedAt") OffsetDateTime updatedAt);

    @Query("select s.revision from BoundPlanSession s where s.sessionId = :sessionId")
    Optional<Long> findRevisionBySessionId(@Param("sessionId") String sessionId);
}
