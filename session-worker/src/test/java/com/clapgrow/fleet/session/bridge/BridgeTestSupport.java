package com.clapgrow.fleet.session.bridge;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * WebClient whose exchanges are answered in-process, recording every request.
 */
class BridgeTestSupport {

    final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private volatile HttpStatus status = HttpStatus.OK;
    private volatile String body = "{}";

    void respond(HttpStatus status, String body) {
        this.status = status;
        this.body = body;
    }

    WebClient webClient() {
        return WebClient.builder()
            .baseUrl("http://bridge.test")
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
    }

    ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
