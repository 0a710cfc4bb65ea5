package com.gocomet.bustracking.location.repository;

import com.gocomet.bustracking.location.model.BusLocationHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface BusLocationHistoryRepository extends JpaRepository<BusLocationHistory, UUID> {
}
