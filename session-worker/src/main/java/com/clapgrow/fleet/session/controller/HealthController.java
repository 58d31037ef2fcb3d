package com.clapgrow.fleet.session.controller;

import com.clapgrow.fleet.session.session.SessionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Liveness of the worker")
public class HealthController {

    private final SessionRegistry registry;

    @GetMapping("/health")
    @Operation(
            summary = "Health check",
            description = "Reports that the worker is up, with the number of registered and open sessions."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Worker is up")
    })
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("service", "session-worker");
        response.put("registeredSessions", registry.handles().size());
        response.put("openSessions", registry.listActive().size());
        return ResponseEntity.ok(response);
    }
}
