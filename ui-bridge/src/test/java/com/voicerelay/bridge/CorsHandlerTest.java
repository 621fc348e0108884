package com.voicerelay.bridge;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CorsHandlerTest {

    @Test
    void preflightIsAnsweredDirectly() {
        EmbeddedChannel ch = new EmbeddedChannel(RelayHttpServer.CorsHandler.INSTANCE);
        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.OPTIONS, "/api/send"));

        FullHttpResponse resp = ch.readOutbound();
        assertEquals(HttpResponseStatus.OK, resp.status());
        assertEquals("*", resp.headers().get(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN));
        assertNull(ch.readInbound(), "Preflight must not reach the API handler");
        resp.release();
    }

    @Test
    void otherRequestsPassThrough() {
        EmbeddedChannel ch = new EmbeddedChannel(RelayHttpServer.CorsHandler.INSTANCE);
        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/api/health", Unpooled.EMPTY_BUFFER));

        FullHttpRequest passed = ch.readInbound();
        assertNotNull(passed);
        assertEquals("/api/health", passed.uri());
        assertNull(ch.readOutbound());
        passed.release();
    }
}
