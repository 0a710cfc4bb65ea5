package com.gocomet.bustracking.location.service;

import com.gocomet.bustracking.broadcast.RealtimeBroadcaster;
import com.gocomet.bustracking.bus.model.Bus;
import com.gocomet.bustracking.bus.model.BusStatus;
import com.gocomet.bustracking.bus.service.BusAssignmentService;
import com.gocomet.bustracking.bus.service.BusGeoIndexService;
import com.gocomet.bustracking.common.config.RealtimeProperties;
import com.gocomet.bustracking.common.exception.LocationRejectedException;
import com.gocomet.bustracking.common.exception.NotAssignedException;
import com.gocomet.bustracking.common.exception.ResourceNotFoundException;
import com.gocomet.bustracking.common.exception.RouteMissingException;
import com.gocomet.bustracking.common.exception.ThrottledException;
import com.gocomet.bustracking.location.dto.LocationAck;
import com.gocomet.bustracking.location.dto.LocationReportRequest;
import com.gocomet.bustracking.location.dto.LocationUpdateEvent;
import com.gocomet.bustracking.location.guard.AntiSpoofGuard;
import com.gocomet.bustracking.location.guard.InMemoryBusPositionStateStore;
import com.gocomet.bustracking.location.model.BusLocation;
import com.gocomet.bustracking.location.repository.BusLocationHistoryRepository;
import com.gocomet.bustracking.location.repository.BusLocationRepository;
import com.gocomet.bustracking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LocationIngestionServiceTest {

    private static final String BUS = "BUS-7";
    private static final String DRIVER = "drv-1";
    private static final String ROUTE = "R1";

    @Mock
    private BusAssignmentService busAssignmentService;

    @Mock
    private BusLocationRepository busLocationRepository;

    @Mock
    private BusLocationHistoryRepository historyRepository;

    @Mock
    private BusGeoIndexService geoIndexService;

    @Mock
    private RealtimeBroadcaster broadcaster;

    private MutableClock clock;
    private RealtimeProperties properties;
    private LocationIngestionService locationIngestionService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        properties = new RealtimeProperties();
        AntiSpoofGuard guard = new AntiSpoofGuard(new InMemoryBusPositionStateStore(properties), properties);
        locationIngestionService = new LocationIngestionService(busAssignmentService, guard,
                busLocationRepository, historyRepository, geoIndexService, broadcaster, properties, clock);
    }

    private Bus assignedBus(String routeId) {
        return Bus.builder().id(BUS).routeId(routeId).assignedDriverId(DRIVER)
                .status(BusStatus.ENROUTE).capacity(40).build();
    }

    private LocationReportRequest at(double lat, double lng) {
        return LocationReportRequest.builder().latitude(lat).longitude(lng).build();
    }

    @Test
    void testReportLocation_ValidSample_SavesAndPublishesOnRouteChannel() {
        // Arrange
        when(busAssignmentService.requireAssignedDriver(BUS, DRIVER)).thenReturn(assignedBus(ROUTE));

        // Act
        LocationAck ack = locationIngestionService.reportLocation(DRIVER, BUS, at(12.9716, 77.5946));

        // Assert
        ArgumentCaptor<BusLocation> saved = ArgumentCaptor.forClass(BusLocation.class);
        verify(busLocationRepository).save(saved.capture());
        assertEquals(ROUTE, saved.getValue().getRouteId());
        assertEquals(clock.instant(), saved.getValue().getCapturedAt());
        verify(geoIndexService).updateBusLocation(BUS, ROUTE, 12.9716, 77.5946);
        verify(broadcaster).publish(eq("route_R1"), eq("location_update"), any(LocationUpdateEvent.class));
        assertEquals(BUS, ack.getBusId());
        assertFalse(ack.isOverspeedWarning());
    }

    @Test
    void testReportLocation_TwoSamplesHalfSecondApart_SecondIsThrottledAndNotSaved() {
        // Arrange
        when(busAssignmentService.requireAssignedDriver(BUS, DRIVER)).thenReturn(assignedBus(ROUTE));
        locationIngestionService.reportLocation(DRIVER, BUS, at(12.9716, 77.5946));
        clock.advance(Duration.ofMillis(500));

        // Act & Assert
        assertThrows(ThrottledException.class,
                () -> locationIngestionService.reportLocation(DRIVER, BUS, at(12.9717, 77.5946)));
        verify(busLocationRepository, times(1)).save(any(BusLocation.class));
        verify(broadcaster, times(1)).publish(anyString(), anyString(), any());
    }

    @Test
    void testReportLocation_ImplausibleJump_IsRejected() {
        // Arrange
        when(busAssignmentService.requireAssignedDriver(BUS, DRIVER)).thenReturn(assignedBus(ROUTE));
        locationIngestionService.reportLocation(DRIVER, BUS, at(12.9716, 77.5946));
        clock.advance(Duration.ofSeconds(10));

        // Act & Assert
        assertThrows(LocationRejectedException.class,
                () -> locationIngestionService.reportLocation(DRIVER, BUS, at(12.9791, 77.5946)));
        verify(busLocationRepository, times(1)).save(any(BusLocation.class));
    }

    @Test
    void testReportLocation_ImplausibleJumpUnderWarnPolicy_IsStoredWithWarning() {
        // Arrange
        properties.getAntiSpoof().setOverspeedPolicy(com.gocomet.bustracking.location.guard.OverspeedPolicy.WARN);
        when(busAssignmentService.requireAssignedDriver(BUS, DRIVER)).thenReturn(assignedBus(ROUTE));
        locationIngestionService.reportLocation(DRIVER, BUS, at(12.9716, 77.5946));
        clock.advance(Duration.ofSeconds(10));

        // Act
        LocationAck ack = locationIngestionService.reportLocation(DRIVER, BUS, at(12.9791, 77.5946));

        // Assert
        assertTrue(ack.isOverspeedWarning());
        verify(busLocationRepository, times(2)).save(any(BusLocation.class));
    }

    @Test
    void testReportLocation_DriverNotAssigned_ThrowsAndStoresNothing() {
        // Arrange
        when(busAssignmentService.requireAssignedDriver(BUS, "intruder"))
                .thenThrow(new NotAssignedException("intruder", BUS));

        // Act & Assert
        assertThrows(NotAssignedException.class,
                () -> locationIngestionService.reportLocation("intruder", BUS, at(12.9716, 77.5946)));
        verifyNoInteractions(busLocationRepository, broadcaster);
    }

    @Test
    void testReportLocation_BusWithoutRoute_ThrowsRouteMissing() {
        // Arrange
        when(busAssignmentService.requireAssignedDriver(BUS, DRIVER)).thenReturn(assignedBus(null));

        // Act & Assert
        assertThrows(RouteMissingException.class,
                () -> locationIngestionService.reportLocation(DRIVER, BUS, at(12.9716, 77.5946)));
        verifyNoInteractions(busLocationRepository);
    }

    @Test
    void testReportLocation_OutOfRangeLatitude_IsRejectedBeforeAssignmentCheck() {
        // Act & Assert
        assertThrows(LocationRejectedException.class,
                () -> locationIngestionService.reportLocation(DRIVER, BUS, at(91.0, 77.5946)));
        verifyNoInteractions(busAssignmentService, busLocationRepository);
    }

    @Test
    void testReportLocation_MissingLongitude_IsRejected() {
        // Arrange
        LocationReportRequest request = LocationReportRequest.builder().latitude(12.9716).build();

        // Act & Assert
        assertThrows(LocationRejectedException.class,
                () -> locationIngestionService.reportLocation(DRIVER, BUS, request));
    }

    @ParameterizedTest
    @CsvSource({
            "-1.0, 90.0",
            "NaN, 90.0",
            "50.0, 90.0",
            "10.0, -0.5",
            "10.0, 360.0",
            "10.0, Infinity"
    })
    void testReportLocation_ImplausibleDeviceSpeedOrHeading_IsRejectedBeforeAssignmentCheck(double speed,
                                                                                             double heading) {
        // Arrange
        LocationReportRequest request = at(12.9716, 77.5946);
        request.setSpeedMetersPerSecond(speed);
        request.setHeadingDegrees(heading);

        // Act & Assert
        assertThrows(LocationRejectedException.class,
                () -> locationIngestionService.reportLocation(DRIVER, BUS, request));
        verifyNoInteractions(busAssignmentService, busLocationRepository);
    }

    @Test
    void testReportLocation_PlausibleSpeedAndHeading_AreStored() {
        // Arrange
        when(busAssignmentService.requireAssignedDriver(BUS, DRIVER)).thenReturn(assignedBus(ROUTE));
        LocationReportRequest request = at(12.9716, 77.5946);
        request.setSpeedMetersPerSecond(12.5);
        request.setHeadingDegrees(359.9);

        // Act
        locationIngestionService.reportLocation(DRIVER, BUS, request);

        // Assert
        ArgumentCaptor<BusLocation> saved = ArgumentCaptor.forClass(BusLocation.class);
        verify(busLocationRepository).save(saved.capture());
        assertEquals(12.5, saved.getValue().getSpeedMetersPerSecond().doubleValue());
        assertEquals(359.9, saved.getValue().getHeadingDegrees().doubleValue());
    }

    @Test
    void testReportLocation_HistoryAndIndexFailures_DoNotFailTheReport() {
        // Arrange
        when(busAssignmentService.requireAssignedDriver(BUS, DRIVER)).thenReturn(assignedBus(ROUTE));
        when(historyRepository.save(any())).thenThrow(new DataAccessResourceFailureException("history down"));
        doThrow(new RuntimeException("redis down")).when(geoIndexService)
                .updateBusLocation(anyString(), anyString(), anyDouble(), anyDouble());

        // Act
        LocationAck ack = locationIngestionService.reportLocation(DRIVER, BUS, at(12.9716, 77.5946));

        // Assert
        assertNotNull(ack);
        verify(broadcaster).publish(eq("route_R1"), eq("location_update"), any());
    }

    @Test
    void testReportLocation_RouteMismatchInRequest_UsesBusRoute() {
        // Arrange
        when(busAssignmentService.requireAssignedDriver(BUS, DRIVER)).thenReturn(assignedBus(ROUTE));
        LocationReportRequest request = at(12.9716, 77.5946);
        request.setRouteId("R9");

        // Act
        LocationAck ack = locationIngestionService.reportLocation(DRIVER, BUS, request);

        // Assert
        assertEquals(ROUTE, ack.getRouteId());
        verify(broadcaster).publish(eq("route_R1"), eq("location_update"), any());
    }

    @Test
    void testGetCurrentLocation_Unknown_ThrowsNotFound() {
        when(busLocationRepository.findById(BUS)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> locationIngestionService.getCurrentLocation(BUS));
    }
}
