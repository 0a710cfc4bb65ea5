package com.gocomet.bustracking.flag.controller;

import com.gocomet.bustracking.flag.dto.BoardFlagRequest;
import com.gocomet.bustracking.flag.dto.FlagLocationUpdateResponse;
import com.gocomet.bustracking.flag.dto.RaiseFlagRequest;
import com.gocomet.bustracking.flag.dto.UpdateFlagLocationRequest;
import com.gocomet.bustracking.flag.dto.WaitingFlagResponse;
import com.gocomet.bustracking.flag.service.WaitingFlagService;
import com.gocomet.bustracking.security.AuthPrincipal;
import com.gocomet.bustracking.security.IdentityVerifier;
import com.gocomet.bustracking.security.Role;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class WaitingFlagController {

    private final WaitingFlagService waitingFlagService;
    private final IdentityVerifier identityVerifier;

    /**
     * POST /v1/waiting-flags: Rider raises a flag at a stop
     */
    @PostMapping("/waiting-flags")
    public ResponseEntity<WaitingFlagResponse> raise(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @Valid @RequestBody RaiseFlagRequest request) {

        AuthPrincipal student = identityVerifier.verify(authorization, Role.STUDENT);
        WaitingFlagResponse response = waitingFlagService.raise(student.getPrincipalId(), student.getName(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * PUT /v1/waiting-flags/{id}/location: Periodic rider position
     */
    @PutMapping("/waiting-flags/{id}/location")
    public ResponseEntity<FlagLocationUpdateResponse> updateLocation(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable UUID id,
            @Valid @RequestBody UpdateFlagLocationRequest request) {

        AuthPrincipal student = identityVerifier.verify(authorization, Role.STUDENT);
        return ResponseEntity.ok(waitingFlagService.updateLocation(id, student.getPrincipalId(),
                request.getLatitude(), request.getLongitude()));
    }

    /**
     * POST /v1/waiting-flags/{id}/acknowledge: Driver has seen the rider
     */
    @PostMapping("/waiting-flags/{id}/acknowledge")
    public ResponseEntity<WaitingFlagResponse> acknowledge(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable UUID id) {

        AuthPrincipal driver = identityVerifier.verify(authorization, Role.DRIVER);
        return ResponseEntity.ok(waitingFlagService.acknowledge(id, driver.getPrincipalId()));
    }

    /**
     * POST /v1/waiting-flags/{id}/board: Driver confirms boarding
     */
    @PostMapping("/waiting-flags/{id}/board")
    public ResponseEntity<WaitingFlagResponse> markBoarded(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable UUID id,
            @Valid @RequestBody BoardFlagRequest request) {

        AuthPrincipal driver = identityVerifier.verify(authorization, Role.DRIVER);
        return ResponseEntity.ok(waitingFlagService.markBoarded(id, request.getStudentId(), request.getBusId(),
                driver.getPrincipalId()));
    }

    /**
     * POST /v1/waiting-flags/{id}/cancel: Rider withdraws the flag
     */
    @PostMapping("/waiting-flags/{id}/cancel")
    public ResponseEntity<WaitingFlagResponse> cancel(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable UUID id) {

        AuthPrincipal student = identityVerifier.verify(authorization, Role.STUDENT);
        return ResponseEntity.ok(waitingFlagService.cancel(id, student.getPrincipalId()));
    }

    /**
     * GET /v1/buses/{busId}/waiting-flags: Active flags for the driver's bus
     */
    @GetMapping("/buses/{busId}/waiting-flags")
    public ResponseEntity<List<WaitingFlagResponse>> getActiveFlags(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String busId) {

        AuthPrincipal driver = identityVerifier.verify(authorization, Role.DRIVER);
        return ResponseEntity.ok(waitingFlagService.getActiveFlagsForBus(busId, driver.getPrincipalId()));
    }
}
