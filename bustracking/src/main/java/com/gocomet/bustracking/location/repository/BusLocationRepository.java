package com.gocomet.bustracking.location.repository;

import com.gocomet.bustracking.location.model.BusLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface BusLocationRepository extends JpaRepository<BusLocation, String> {

    List<BusLocation> findByBusIdInAndCapturedAtAfter(Collection<String> busIds, Instant since);
}
