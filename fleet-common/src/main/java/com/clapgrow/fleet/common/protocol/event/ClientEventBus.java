package com.clapgrow.fleet.common.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Publish/subscribe hub owned by one protocol client.
 * 
 * <p>Rules:
 * <ul>
 *   <li>Listeners run synchronously, in subscription order</li>
 *   <li>Publishing is serialized per bus, so one tenant's events are handled in transport order</li>
 *   <li>A failing listener is logged and does not stop delivery to the next one</li>
 *   <li>A listener removed while an event is being delivered does not receive that event</li>
 * </ul>
 */
@Slf4j
public class ClientEventBus {

    private final String owner;
    private final List<ClientEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Object publishLock = new Object();

    public ClientEventBus(String owner) {
        this.owner = owner;
    }

    public void subscribe(ClientEventListener listener) {
        listeners.add(listener);
    }

    public void removeAllListeners() {
        listeners.clear();
        log.debug("Detached all listeners for {}", owner);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publishConnectionUpdate(ConnectionUpdate update) {
        publish("connection.update", listener -> listener.onConnectionUpdate(update));
    }

    public void publishCredentialsUpdate(JsonNode credentials) {
        publish("creds.update", listener -> listener.onCredentialsUpdate(credentials));
    }

    public void publishCalls(List<CallOffer> calls) {
        publish("call", listener -> listener.onCalls(calls));
    }

    public void publishMessagesUpsert(List<InboundMessage> messages) {
        publish("messages.upsert", listener -> listener.onMessagesUpsert(messages));
    }

    public void publishMessagesUpdate(List<MessageUpdate> updates) {
        publish("messages.update", listener -> listener.onMessagesUpdate(updates));
    }

    private void publish(String eventName, Consumer<ClientEventListener> delivery) {
        synchronized (publishLock) {
            for (ClientEventListener listener : listeners) {
                if (!listeners.contains(listener)) {
                    continue;
                }
                try {
                    delivery.accept(listener);
                } catch (RuntimeException e) {
                    log.error("Listener {} failed on {} for {}", 
                        listener.getClass().getSimpleName(), eventName, owner, e);
                }
            }
        }
    }
}
