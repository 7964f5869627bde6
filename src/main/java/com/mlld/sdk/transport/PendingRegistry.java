package com.mlld.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request id to delivery channel mapping shared by the sending side and the
 * stdout reader of one session.
 *
 * <p>The lock is held only to look up or change the map; messages are delivered
 * after it is released. An id receives exactly one terminal message: whoever
 * removes the entry (result routing, failure broadcast or explicit removal) owns
 * that delivery.
 */
public final class PendingRegistry {

    private final Map<Long, ResponseChannel> channels = new HashMap<>();
    private String closedReason;

    /**
     * Create and insert a channel for the id. If the registry was already closed
     * the channel immediately receives {@code Closed} with the recorded reason.
     */
    public ResponseChannel register(long requestId) {
        ResponseChannel channel = new ResponseChannel(requestId);
        String reason;
        synchronized (this) {
            reason = closedReason;
            if (reason == null) {
                channels.put(requestId, channel);
            }
        }
        if (reason != null) {
            channel.deliver(TransportMessage.closed(reason));
        }
        return channel;
    }

    public synchronized boolean remove(long requestId) {
        return channels.remove(requestId) != null;
    }

    public synchronized boolean contains(long requestId) {
        return channels.containsKey(requestId);
    }

    public synchronized int size() {
        return channels.size();
    }

    public synchronized boolean isClosed() {
        return closedReason != null;
    }

    /**
     * Deliver an event, keeping the entry registered.
     *
     * @return whether a channel was registered for the id
     */
    public boolean routeEvent(long requestId, JsonNode event) {
        ResponseChannel channel;
        synchronized (this) {
            channel = channels.get(requestId);
        }
        if (channel == null) {
            return false;
        }
        channel.deliver(TransportMessage.event(event));
        return true;
    }

    /**
     * Remove the entry and deliver its terminal result.
     *
     * @return whether a channel was registered for the id
     */
    public boolean routeResult(long requestId, JsonNode result) {
        ResponseChannel channel;
        synchronized (this) {
            channel = channels.remove(requestId);
        }
        if (channel == null) {
            return false;
        }
        channel.deliver(TransportMessage.result(result));
        return true;
    }

    /**
     * Deliver {@code Closed(reason)} to every registered id and empty the registry.
     * The registry stays open for new registrations.
     *
     * @return the number of requests notified
     */
    public int failAll(String reason) {
        List<ResponseChannel> drained;
        synchronized (this) {
            drained = drainLocked();
        }
        drained.forEach(channel -> channel.deliver(TransportMessage.closed(reason)));
        return drained.size();
    }

    /**
     * Like {@link #failAll(String)}, and every later registration is closed at once.
     */
    public int close(String reason) {
        List<ResponseChannel> drained;
        synchronized (this) {
            if (closedReason == null) {
                closedReason = reason;
            }
            drained = drainLocked();
        }
        drained.forEach(channel -> channel.deliver(TransportMessage.closed(reason)));
        return drained.size();
    }

    /**
     * Drop every remaining entry, marking its channel as disconnected.
     */
    public int disconnectAll() {
        List<ResponseChannel> drained;
        synchronized (this) {
            if (closedReason == null) {
                closedReason = "live transport closed";
            }
            drained = drainLocked();
        }
        drained.forEach(ResponseChannel::disconnect);
        return drained.size();
    }

    private List<ResponseChannel> drainLocked() {
        List<ResponseChannel> drained = new ArrayList<>(channels.values());
        channels.clear();
        return drained;
    }
}
