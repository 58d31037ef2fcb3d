package com.clapgrow.fleet.session.session;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConnectResultTest {

    @Test
    void testNewPairingBody_CarriesCode() {
        Map<String, Object> body = ConnectResult.newPairing("ABCD1234").toBody();

        assertEquals(true, body.get("success"));
        assertEquals("new_pairing", body.get("status"));
        assertEquals("ABCD1234", body.get("code"));
        assertFalse(body.containsKey("connected"));
    }

    @Test
    void testAlreadyConnectedBody_CarriesSessionStatus() {
        Instant since = Instant.parse("2026-01-01T10:00:00Z");
        Map<String, Object> body = ConnectResult.alreadyConnected(new SessionStatus(true, since, 42)).toBody();

        assertEquals("already_connected", body.get("status"));
        assertEquals(true, body.get("connected"));
        assertEquals(since, body.get("connectedAt"));
        assertEquals(42L, body.get("uptime"));
    }

    @Test
    void testFailures_AreNotSuccessful() {
        assertFalse((Boolean) ConnectResult.pairingFailed("x").toBody().get("success"));
        assertFalse((Boolean) ConnectResult.error("x").toBody().get("success"));
        assertFalse(ConnectResult.inProgress().isFailure());
    }

    @Test
    void testCompletableSink_FirstResponseWins() {
        CompletableConnectSink sink = new CompletableConnectSink();

        assertTrue(sink.respond(ConnectResult.reconnecting()));
        assertFalse(sink.respond(ConnectResult.error("late")));
        assertEquals(ConnectStatus.RECONNECTING, sink.future().join().status());
    }
}
