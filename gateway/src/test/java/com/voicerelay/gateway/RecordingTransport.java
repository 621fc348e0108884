package com.voicerelay.gateway;

import com.voicerelay.gateway.connection.GatewayTransport;
import com.voicerelay.protocol.RequestFrame;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory transport: records every written request, toggled up/down by the test. */
public final class RecordingTransport implements GatewayTransport {

    public final List<RequestFrame> written  = new CopyOnWriteArrayList<>();
    public final AtomicInteger      connects = new AtomicInteger();
    public final AtomicInteger      stops    = new AtomicInteger();

    private volatile boolean authenticated;
    private volatile boolean failWrites;

    public RecordingTransport(boolean authenticated) {
        this.authenticated = authenticated;
    }

    public void setAuthenticated(boolean authenticated) {
        this.authenticated = authenticated;
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public RequestFrame last() {
        return written.get(written.size() - 1);
    }

    @Override
    public void connect() {
        connects.incrementAndGet();
    }

    @Override
    public void stop() {
        stops.incrementAndGet();
    }

    @Override
    public boolean isAuthenticated() {
        return authenticated;
    }

    @Override
    public void write(RequestFrame frame) {
        if (!authenticated) throw new NotConnectedException();
        if (failWrites) throw new IllegalStateException("channel write failed");
        written.add(frame);
    }
}
