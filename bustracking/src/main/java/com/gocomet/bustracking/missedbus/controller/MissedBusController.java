package com.gocomet.bustracking.missedbus.controller;

import com.gocomet.bustracking.missedbus.dto.MissedBusRequestResponse;
import com.gocomet.bustracking.missedbus.dto.RaiseMissedBusRequest;
import com.gocomet.bustracking.missedbus.dto.RaiseMissedBusResponse;
import com.gocomet.bustracking.missedbus.service.MissedBusService;
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
public class MissedBusController {

    private final MissedBusService missedBusService;
    private final IdentityVerifier identityVerifier;

    /**
     * POST /v1/missed-bus: Request an alternate bus (idempotent on operationId)
     */
    @PostMapping("/missed-bus")
    public ResponseEntity<RaiseMissedBusResponse> raise(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @Valid @RequestBody RaiseMissedBusRequest request) {

        AuthPrincipal student = identityVerifier.verify(authorization, Role.STUDENT);
        RaiseMissedBusResponse response = missedBusService.raise(student.getPrincipalId(), request);
        return ResponseEntity.status(statusFor(response)).body(response);
    }

    /**
     * POST /v1/missed-bus/{id}/cancel: Withdraw a pending request
     */
    @PostMapping("/missed-bus/{id}/cancel")
    public ResponseEntity<MissedBusRequestResponse> cancel(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable UUID id) {

        AuthPrincipal student = identityVerifier.verify(authorization, Role.STUDENT);
        return ResponseEntity.ok(missedBusService.cancel(id, student.getPrincipalId()));
    }

    /**
     * GET /v1/missed-bus/active: Rider's pending or approved request, 204 if none
     */
    @GetMapping("/missed-bus/active")
    public ResponseEntity<MissedBusRequestResponse> getActive(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {

        AuthPrincipal student = identityVerifier.verify(authorization, Role.STUDENT);
        return missedBusService.getActiveRequest(student.getPrincipalId())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * GET /v1/buses/{busId}/pickups: Approved pickups assigned to the driver's bus
     */
    @GetMapping("/buses/{busId}/pickups")
    public ResponseEntity<List<MissedBusRequestResponse>> getPickups(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String busId) {

        AuthPrincipal driver = identityVerifier.verify(authorization, Role.DRIVER);
        return ResponseEntity.ok(missedBusService.getPickupsForBus(busId, driver.getPrincipalId()));
    }

    private HttpStatus statusFor(RaiseMissedBusResponse response) {
        return switch (response.getStage()) {
            case MAINTENANCE -> HttpStatus.SERVICE_UNAVAILABLE;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case DUPLICATE -> HttpStatus.CONFLICT;
            case CREATED -> response.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        };
    }
}
