package com.gocomet.bustracking.bus.service;

import com.gocomet.bustracking.bus.model.Bus;
import com.gocomet.bustracking.bus.repository.BusRepository;
import com.gocomet.bustracking.common.exception.NotAssignedException;
import com.gocomet.bustracking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Reads of the bus-to-driver assignment. Assignment itself is managed elsewhere.
 */
@Service
@RequiredArgsConstructor
public class BusAssignmentService {

    private final BusRepository busRepository;

    public Bus getBus(String busId) {
        return busRepository.findById(busId)
                .orElseThrow(() -> new ResourceNotFoundException("Bus", "id", busId));
    }

    /**
     * Loads the bus and checks that the driver is the one currently assigned to it.
     */
    public Bus requireAssignedDriver(String busId, String driverId) {
        Bus bus = getBus(busId);
        if (bus.getAssignedDriverId() == null || !bus.getAssignedDriverId().equals(driverId)) {
            throw new NotAssignedException(driverId, busId);
        }
        return bus;
    }
}
