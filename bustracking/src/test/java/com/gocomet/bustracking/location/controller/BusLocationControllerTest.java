package com.gocomet.bustracking.location.controller;

import com.gocomet.bustracking.common.exception.GlobalExceptionHandler;
import com.gocomet.bustracking.common.exception.NotAssignedException;
import com.gocomet.bustracking.common.exception.ThrottledException;
import com.gocomet.bustracking.common.exception.UnauthorizedException;
import com.gocomet.bustracking.location.dto.LocationAck;
import com.gocomet.bustracking.location.dto.LocationReportRequest;
import com.gocomet.bustracking.location.service.LocationIngestionService;
import com.gocomet.bustracking.security.AuthPrincipal;
import com.gocomet.bustracking.security.IdentityVerifier;
import com.gocomet.bustracking.security.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BusLocationControllerTest {

    private static final String AUTH = "Bearer driver-token";

    @Mock
    private LocationIngestionService ingestionService;

    @Mock
    private IdentityVerifier identityVerifier;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BusLocationController(ingestionService, identityVerifier))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private void driverSignedIn() {
        when(identityVerifier.verify(AUTH, Role.DRIVER)).thenReturn(new AuthPrincipal("drv-1", Role.DRIVER, "Ravi"));
    }

    @Test
    void testReportLocation_Accepted_Returns200WithAck() throws Exception {
        driverSignedIn();
        when(ingestionService.reportLocation(eq("drv-1"), eq("BUS-7"), any(LocationReportRequest.class)))
                .thenReturn(LocationAck.builder().busId("BUS-7").routeId("R1").latitude(12.97).longitude(77.59).build());

        mockMvc.perform(post("/v1/buses/BUS-7/location")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":12.97,\"longitude\":77.59}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.busId").value("BUS-7"))
                .andExpect(jsonPath("$.routeId").value("R1"));
    }

    @Test
    void testReportLocation_Throttled_Returns429() throws Exception {
        driverSignedIn();
        when(ingestionService.reportLocation(eq("drv-1"), eq("BUS-7"), any(LocationReportRequest.class)))
                .thenThrow(new ThrottledException("too fast"));

        mockMvc.perform(post("/v1/buses/BUS-7/location")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":12.97,\"longitude\":77.59}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("THROTTLED"));
    }

    @Test
    void testReportLocation_NotAssigned_Returns403() throws Exception {
        driverSignedIn();
        when(ingestionService.reportLocation(eq("drv-1"), eq("BUS-7"), any(LocationReportRequest.class)))
                .thenThrow(new NotAssignedException("drv-1", "BUS-7"));

        mockMvc.perform(post("/v1/buses/BUS-7/location")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":12.97,\"longitude\":77.59}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_ASSIGNED"));
    }

    @Test
    void testReportLocation_MissingLatitude_Returns400() throws Exception {
        mockMvc.perform(post("/v1/buses/BUS-7/location")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"longitude\":77.59}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
        verifyNoInteractions(ingestionService);
    }

    @Test
    void testReportLocation_NoAuthorizationHeader_Returns401() throws Exception {
        mockMvc.perform(post("/v1/buses/BUS-7/location")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":12.97,\"longitude\":77.59}"))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(ingestionService);
    }

    @Test
    void testReportLocation_StudentToken_Returns401() throws Exception {
        when(identityVerifier.verify(AUTH, Role.DRIVER)).thenThrow(new UnauthorizedException("wrong role"));

        mockMvc.perform(post("/v1/buses/BUS-7/location")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":12.97,\"longitude\":77.59}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    void testGetCurrentLocation_AnySignedInUser_Returns200() throws Exception {
        when(identityVerifier.verify(AUTH)).thenReturn(new AuthPrincipal("stu-1", Role.STUDENT, "Asha"));
        when(ingestionService.getCurrentLocation("BUS-7"))
                .thenReturn(LocationAck.builder().busId("BUS-7").latitude(12.97).longitude(77.59).build());

        mockMvc.perform(get("/v1/buses/BUS-7/location").header(HttpHeaders.AUTHORIZATION, AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.latitude").value(12.97));
    }
}
