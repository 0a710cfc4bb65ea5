package com.gocomet.bustracking.flag.repository;

import com.gocomet.bustracking.flag.model.FlagStatus;
import com.gocomet.bustracking.flag.model.WaitingFlag;
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

/**
 * Status changes go through conditional UPDATEs: each returns the number of rows
 * changed, so 0 means another actor already moved the flag.
 */
@Repository
public interface WaitingFlagRepository extends JpaRepository<WaitingFlag, UUID> {

    Optional<WaitingFlag> findFirstByStudentIdAndBusIdAndStatusIn(String studentId, String busId,
                                                                   Collection<FlagStatus> statuses);

    List<WaitingFlag> findByBusIdAndStatusInOrderByCreatedAtAsc(String busId, Collection<FlagStatus> statuses);

    List<WaitingFlag> findByStatusInAndExpiresAtLessThanEqual(Collection<FlagStatus> statuses, Instant now,
                                                              Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE WaitingFlag f SET f.status = com.gocomet.bustracking.flag.model.FlagStatus.ACKNOWLEDGED, "
            + "f.acknowledgedByDriverId = :driverId, f.acknowledgedAt = :now "
            + "WHERE f.id = :id AND f.status = com.gocomet.bustracking.flag.model.FlagStatus.RAISED")
    int acknowledge(@Param("id") UUID id, @Param("driverId") String driverId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE WaitingFlag f SET f.status = :target, f.closedAt = :now, f.activeKey = NULL "
            + "WHERE f.id = :id AND f.status IN :from")
    int close(@Param("id") UUID id, @Param("from") Collection<FlagStatus> from,
              @Param("target") FlagStatus target, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE WaitingFlag f SET f.status = com.gocomet.bustracking.flag.model.FlagStatus.EXPIRED, "
            + "f.closedAt = :now, f.activeKey = NULL "
            + "WHERE f.id = :id AND f.status IN :from AND f.expiresAt <= :now")
    int expire(@Param("id") UUID id, @Param("from") Collection<FlagStatus> from, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE WaitingFlag f SET f.latitude = :lat, f.longitude = :lng, f.locationUpdatedAt = :now "
            + "WHERE f.id = :id AND f.status IN :from")
    int updateLocation(@Param("id") UUID id, @Param("lat") double lat, @Param("lng") double lng,
                       @Param("from") Collection<FlagStatus> from, @Param("now") Instant now);
}
