package com.voicerelay.gateway.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans events out to every subscribed downstream listener.
 *
 * Listeners are keyed by a numeric handle handed out on subscribe.
 * Accessed from the gateway event loop (publish) and from browser channels
 * (subscribe/unsubscribe); guarded by synchronized blocks, and delivery happens
 * on a snapshot outside the lock.
 */
public final class Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final ObjectMapper mapper;
    private final Long2ObjectOpenHashMap<BroadcastListener> listeners = new Long2ObjectOpenHashMap<>();
    private final AtomicLong nextHandle = new AtomicLong(1);

    public Broadcaster(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public synchronized long subscribe(BroadcastListener listener) {
        long handle = nextHandle.getAndIncrement();
        listeners.put(handle, listener);
        log.debug("Listener {} subscribed ({} total)", handle, listeners.size());
        return handle;
    }

    public synchronized boolean unsubscribe(long handle) {
        boolean removed = listeners.remove(handle) != null;
        if (removed) log.debug("Listener {} unsubscribed ({} left)", handle, listeners.size());
        return removed;
    }

    public synchronized int size() {
        return listeners.size();
    }

    /**
     * Serialize {@code event} once and write it to every open listener.
     *
     * @return number of listeners the event was handed to
     */
    public int publish(Object event) {
        String json;
        try {
            json = mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize broadcast event {}: {}", event, e.getMessage());
            return 0;
        }

        // Copy out: fastutil entries are views into the table and move on removal
        long[] handles;
        BroadcastListener[] targets;
        synchronized (this) {
            handles = new long[listeners.size()];
            targets = new BroadcastListener[listeners.size()];
            int i = 0;
            for (Long2ObjectMap.Entry<BroadcastListener> entry : listeners.long2ObjectEntrySet()) {
                handles[i] = entry.getLongKey();
                targets[i] = entry.getValue();
                i++;
            }
        }

        int delivered = 0;
        for (int i = 0; i < handles.length; i++) {
            long handle = handles[i];
            BroadcastListener listener = targets[i];
            if (!listener.isOpen()) {
                unsubscribe(handle);
                continue;
            }
            try {
                listener.send(json);
                delivered++;
            } catch (Exception e) {
                log.warn("Dropping listener {} after failed write: {}", handle, e.getMessage());
                unsubscribe(handle);
            }
        }
        return delivered;
    }
}
