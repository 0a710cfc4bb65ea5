package com.gocomet.bustracking.bus.repository;

import com.gocomet.bustracking.bus.model.Bus;
import com.gocomet.bustracking.bus.model.BusStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface BusRepository extends JpaRepository<Bus, String> {

    List<Bus> findByRouteIdAndStatusIn(String routeId, Collection<BusStatus> statuses);

    List<Bus> findByIdInAndStatusIn(Collection<String> ids, Collection<BusStatus> statuses);

    /**
     * Takes one seat only while the bus still has room.
     *
     * @return 1 if a seat was reserved, 0 if the bus was full
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Bus b SET b.occupancy = b.occupancy + 1 WHERE b.id = :busId AND b.occupancy < b.capacity")
    int reserveSeat(@Param("busId") String busId);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Bus b SET b.occupancy = b.occupancy - 1 WHERE b.id = :busId AND b.occupancy > 0")
    int releaseSeat(@Param("busId") String busId);
}
