package com.voicerelay.bridge;

import com.voicerelay.gateway.broadcast.BroadcastListener;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

/**
 * Broadcast listener backed by one browser WebSocket channel.
 *
 * Writes are asynchronous; a failed write closes the channel, and
 * {@link PushChannelHandler#channelInactive} unsubscribes it.
 */
final class ChannelBroadcastListener implements BroadcastListener {

    private final Channel channel;

    ChannelBroadcastListener(Channel channel) {
        this.channel = channel;
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public void send(String json) {
        channel.writeAndFlush(new TextWebSocketFrame(json))
               .addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
    }
}
