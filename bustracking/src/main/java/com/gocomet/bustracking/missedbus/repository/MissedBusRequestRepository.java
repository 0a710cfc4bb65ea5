package com.gocomet.bustracking.missedbus.repository;

import com.gocomet.bustracking.missedbus.model.MissedBusRequest;
import com.gocomet.bustracking.missedbus.model.MissedBusStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MissedBusRequestRepository extends JpaRepository<MissedBusRequest, UUID> {

    Optional<MissedBusRequest> findByStudentIdAndOperationId(String studentId, String operationId);

    /**
     * Pending requests, and approved ones whose pickup window is still open.
     */
    @Query("SELECT r FROM MissedBusRequest r WHERE r.studentId = :studentId AND "
            + "(r.status = com.gocomet.bustracking.missedbus.model.MissedBusStatus.PENDING OR "
            + "(r.status = com.gocomet.bustracking.missedbus.model.MissedBusStatus.APPROVED AND r.expiresAt > :now)) "
            + "ORDER BY r.createdAt DESC")
    List<MissedBusRequest> findActive(@Param("studentId") String studentId, @Param("now") Instant now);

    List<MissedBusRequest> findByCandidateBusIdAndStatusAndExpiresAtAfterOrderByCreatedAtAsc(
            String candidateBusId, MissedBusStatus status, Instant now);

    List<MissedBusRequest> findByStatusAndExpiresAtLessThanEqual(MissedBusStatus status, Instant now,
                                                                 Pageable pageable);

    /**
     * Least recently tried first, so a batch smaller than the pending set still
     * reaches every request over successive sweeps.
     */
    List<MissedBusRequest> findByStatusAndExpiresAtAfterOrderByLastMatchAttemptAtAsc(MissedBusStatus status,
                                                                                     Instant now, Pageable pageable);

    List<MissedBusRequest> findByStatusAndSeatHeldTrueAndExpiresAtLessThanEqual(MissedBusStatus status, Instant now,
                                                                                Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE MissedBusRequest r SET r.lastMatchAttemptAt = :now WHERE r.id IN :ids")
    int markMatchAttempted(@Param("ids") Collection<UUID> ids, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE MissedBusRequest r SET r.status = com.gocomet.bustracking.missedbus.model.MissedBusStatus.APPROVED, "
            + "r.candidateBusId = :busId, r.candidateTripId = :tripId, r.resolutionMessage = :message, "
            + "r.resolvedAt = :now, r.pendingKey = NULL, r.seatHeld = true "
            + "WHERE r.id = :id AND r.status = com.gocomet.bustracking.missedbus.model.MissedBusStatus.PENDING "
            + "AND r.expiresAt > :now")
    int approve(@Param("id") UUID id, @Param("busId") String busId, @Param("tripId") String tripId,
                @Param("message") String message, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE MissedBusRequest r SET r.status = :target, r.resolutionMessage = :message, "
            + "r.resolvedAt = :now, r.pendingKey = NULL "
            + "WHERE r.id = :id AND r.status = com.gocomet.bustracking.missedbus.model.MissedBusStatus.PENDING")
    int resolvePending(@Param("id") UUID id, @Param("target") MissedBusStatus target,
                       @Param("message") String message, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE MissedBusRequest r SET r.status = com.gocomet.bustracking.missedbus.model.MissedBusStatus.EXPIRED, "
            + "r.resolutionMessage = :message, r.resolvedAt = :now, r.pendingKey = NULL "
            + "WHERE r.id = :id AND r.status = com.gocomet.bustracking.missedbus.model.MissedBusStatus.PENDING "
            + "AND r.expiresAt <= :now")
    int expire(@Param("id") UUID id, @Param("message") String message, @Param("now") Instant now);

    /**
     * Hands back the seat of an approved request whose pickup window has closed.
     * Only one caller ever sees 1 for a given request.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE MissedBusRequest r SET r.seatHeld = false "
            + "WHERE r.id = :id AND r.status = com.gocomet.bustracking.missedbus.model.MissedBusStatus.APPROVED "
            + "AND r.seatHeld = true AND r.expiresAt <= :now")
    int releaseHeldSeat(@Param("id") UUID id, @Param("now") Instant now);
}
