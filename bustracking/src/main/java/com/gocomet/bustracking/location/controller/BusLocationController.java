package com.gocomet.bustracking.location.controller;

import com.gocomet.bustracking.location.dto.LocationAck;
import com.gocomet.bustracking.location.dto.LocationReportRequest;
import com.gocomet.bustracking.location.service.LocationIngestionService;
import com.gocomet.bustracking.security.AuthPrincipal;
import com.gocomet.bustracking.security.IdentityVerifier;
import com.gocomet.bustracking.security.Role;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/buses")
@RequiredArgsConstructor
public class BusLocationController {

    private final LocationIngestionService ingestionService;
    private final IdentityVerifier identityVerifier;

    /**
     * POST /v1/buses/{busId}/location: Driver position sample
     */
    @PostMapping("/{busId}/location")
    public ResponseEntity<LocationAck> reportLocation(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String busId,
            @Valid @RequestBody LocationReportRequest request) {

        AuthPrincipal driver = identityVerifier.verify(authorization, Role.DRIVER);
        return ResponseEntity.ok(ingestionService.reportLocation(driver.getPrincipalId(), busId, request));
    }

    /**
     * GET /v1/buses/{busId}/location: Last accepted position
     */
    @GetMapping("/{busId}/location")
    public ResponseEntity<LocationAck> getCurrentLocation(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String busId) {

        identityVerifier.verify(authorization);
        return ResponseEntity.ok(ingestionService.getCurrentLocation(busId));
    }
}
