package com.clapgrow.fleet.session.session;

import java.util.concurrent.CompletableFuture;

/**
 * Sink backed by a future; the first response completes it, later ones are ignored.
 */
public class CompletableConnectSink implements ConnectResultSink {

    private final CompletableFuture<ConnectResult> future = new CompletableFuture<>();

    @Override
    public boolean respond(ConnectResult result) {
        return future.complete(result);
    }

    @Override
    public boolean hasResponded() {
        return future.isDone();
    }

    public CompletableFuture<ConnectResult> future() {
        return future;
    }
}
