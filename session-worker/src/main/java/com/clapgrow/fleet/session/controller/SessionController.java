package com.clapgrow.fleet.session.controller;

import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.exception.SessionNotFoundException;
import com.clapgrow.fleet.session.fleet.ConnectAllReport;
import com.clapgrow.fleet.session.fleet.FleetService;
import com.clapgrow.fleet.session.otp.ConfigUpdateService;
import com.clapgrow.fleet.session.session.CompletableConnectSink;
import com.clapgrow.fleet.session.session.ConnectResult;
import com.clapgrow.fleet.session.session.ConnectStatus;
import com.clapgrow.fleet.session.session.SessionStatus;
import com.clapgrow.fleet.session.session.SessionSupervisor;
import com.clapgrow.fleet.session.store.CredentialStore;
import com.clapgrow.fleet.session.store.StatsSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Sessions", description = "Pair, restore, inspect and disconnect sessions")
public class SessionController {

    private final SessionSupervisor supervisor;
    private final FleetService fleetService;
    private final ConfigUpdateService configUpdateService;
    private final CredentialStore credentialStore;
    private final FleetProperties fleetProperties;

    @GetMapping("/code")
    @Operation(
            summary = "Connect a number",
            description = "Restores the number from stored credentials, or starts a new pairing and returns the pairing code."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pairing code, reconnecting, already connected or in progress"),
            @ApiResponse(responseCode = "400", description = "Number missing or invalid"),
            @ApiResponse(responseCode = "500", description = "Connection or pairing failed")
    })
    public CompletableFuture<ResponseEntity<Map<String, Object>>> code(
            @Parameter(description = "Phone number in any format") @RequestParam String number) {
        TenantId tenant = TenantId.of(number);
        CompletableConnectSink sink = new CompletableConnectSink();
        supervisor.connect(tenant, sink);

        ConnectResult stillWaiting = new ConnectResult(ConnectStatus.CONNECTION_IN_PROGRESS,
            "Connection started; the pairing code is not ready yet. Try again shortly.", null, null);
        // The wait bounds this response only; the sink stays open for the pairing flow
        CompletableFuture<ConnectResult> response = sink.future().copy()
            .completeOnTimeout(stillWaiting, fleetProperties.getHttp().getConnectWaitMs(), TimeUnit.MILLISECONDS);
        sink.future().thenAccept(result -> {
            if (response.isDone() && response.join() == stillWaiting) {
                log.warn("Connect result for tenant {} arrived after the request stopped waiting: status={}, code={}",
                    tenant, result.status(), result.code());
            }
        });
        return response
            .thenApply(result -> {
                Map<String, Object> body = result.toBody();
                body.put("number", tenant.value());
                HttpStatus status = result.isFailure() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.OK;
                return ResponseEntity.status(status).body(body);
            });
    }

    @GetMapping("/status")
    @Operation(summary = "Session status", description = "Status of one number, or of every registered session when no number is given.")
    public ResponseEntity<Map<String, Object>> status(@RequestParam(required = false) String number) {
        Map<String, Object> response = new HashMap<>();
        if (number == null || number.isBlank()) {
            List<Map<String, Object>> connections = new ArrayList<>();
            fleetService.statusAll().forEach((tenant, status) -> {
                Map<String, Object> entry = statusBody(status);
                entry.put("number", tenant);
                connections.add(entry);
            });
            response.put("totalActive", fleetService.listActive().size());
            response.put("connections", connections);
            return ResponseEntity.ok(response);
        }

        TenantId tenant = TenantId.of(number);
        SessionStatus status = fleetService.status(tenant);
        response.putAll(statusBody(status));
        response.put("number", tenant.value());
        response.put("message", status.connected() ? "Number is actively connected" : "Number is not connected");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/disconnect")
    @Operation(summary = "Disconnect a number", description = "Closes the session and erases its stored credentials and roster entry.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Disconnected"),
            @ApiResponse(responseCode = "404", description = "No session registered for the number"),
            @ApiResponse(responseCode = "500", description = "Teardown failed")
    })
    public ResponseEntity<Map<String, Object>> disconnect(@RequestParam String number) {
        TenantId tenant = TenantId.of(number);
        fleetService.disconnect(tenant);
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("status", "success");
        response.put("message", "Number disconnected successfully");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/active")
    @Operation(summary = "Active numbers", description = "Numbers whose session is open.")
    public ResponseEntity<Map<String, Object>> active() {
        List<String> numbers = fleetService.listActive().stream().map(TenantId::value).toList();
        Map<String, Object> response = new HashMap<>();
        response.put("count", numbers.size());
        response.put("numbers", numbers);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/ping")
    @Operation(summary = "Liveness with session count")
    public ResponseEntity<Map<String, Object>> ping() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "active");
        response.put("message", fleetProperties.getBotName() + " is running");
        response.put("activeSessions", fleetService.listActive().size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/connect-all")
    @Operation(summary = "Connect every known number", description = "Connects each number of the roster that has no session, one at a time.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Per-number outcomes"),
            @ApiResponse(responseCode = "404", description = "The roster is empty")
    })
    public ResponseEntity<Map<String, Object>> connectAll() {
        ConnectAllReport report = fleetService.connectAll();
        if (report.isEmpty()) {
            throw new SessionNotFoundException("No numbers found to connect");
        }
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("status", "success");
        response.put("total", report.total());
        response.put("skipped", report.skipped());
        response.put("connections", report.outcomes());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/update-config")
    @Operation(summary = "Request a configuration update", description = "Sends a one-time code to the number's own chat; the change applies once the code is verified.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "OTP sent"),
            @ApiResponse(responseCode = "400", description = "Invalid config"),
            @ApiResponse(responseCode = "404", description = "No active session"),
            @ApiResponse(responseCode = "500", description = "OTP could not be sent")
    })
    public ResponseEntity<Map<String, Object>> updateConfig(
            @RequestParam String number,
            @Parameter(description = "JSON object of settings, e.g. {\"ANTI_CALL\":\"true\"}") @RequestParam String config) {
        configUpdateService.requestUpdate(TenantId.of(number), config);
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("status", "otp_sent");
        response.put("message", "OTP sent to your number");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/verify-otp")
    @Operation(summary = "Verify a configuration OTP", description = "Applies the pending configuration change if the code is valid.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Config updated"),
            @ApiResponse(responseCode = "400", description = "Unknown, expired or wrong code")
    })
    public ResponseEntity<Map<String, Object>> verifyOtp(@RequestParam String number, @RequestParam String otp) {
        configUpdateService.verify(TenantId.of(number), otp);
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("status", "success");
        response.put("message", "Config updated successfully");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/stats")
    @Operation(summary = "Usage statistics of a number")
    public ResponseEntity<Map<String, Object>> stats(@RequestParam String number) {
        TenantId tenant = TenantId.of(number);
        StatsSnapshot stats = credentialStore.getStats(tenant);
        SessionStatus status = fleetService.status(tenant);
        Map<String, Object> response = new HashMap<>();
        response.put("number", tenant.value());
        response.put("connectionStatus", status.connected() ? "Connected" : "Disconnected");
        response.put("uptime", status.uptimeSeconds());
        response.put("stats", stats);
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> statusBody(SessionStatus status) {
        Map<String, Object> body = new HashMap<>();
        body.put("isConnected", status.connected());
        body.put("connectionTime", status.connectedAt());
        body.put("uptime", status.uptimeSeconds());
        return body;
    }
}
