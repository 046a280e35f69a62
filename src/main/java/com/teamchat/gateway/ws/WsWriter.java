package com.teamchat.gateway.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * WS 文本协议写出器：统一序列化，保证 writeAndFlush 在 channel 自己的 eventLoop 上执行。
 *
 * <p>连接不可写（出站缓冲超过高水位）时直接丢弃，客户端重连后用 afterId 补齐。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsWriter {

    private final ObjectMapper objectMapper;

    public String encode(WsEnvelope env) {
        try {
            return objectMapper.writeValueAsString(env);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ws envelope encode failed: type=" + env.getType(), e);
        }
    }

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        return writeText(ch, encode(env));
    }

    public ChannelFuture writeError(Channel ch, String reason) {
        return write(ch, WsEnvelope.error(reason));
    }

    /**
     * 广播场景：同一份 JSON 写给多个连接，只序列化一次。
     */
    public ChannelFuture writeText(Channel ch, String json) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        if (!ch.isActive()) {
            return ch.newFailedFuture(new IllegalStateException("channel_inactive"));
        }
        if (!ch.isWritable()) {
            log.debug("ws channel unwritable, drop frame: ch={}", ch.id().asShortText());
            return ch.newFailedFuture(new IllegalStateException("channel_unwritable"));
        }
        if (ch.eventLoop().inEventLoop()) {
            return ch.writeAndFlush(new TextWebSocketFrame(json));
        }
        ChannelPromise promise = ch.newPromise();
        try {
            ch.eventLoop().execute(() -> ch.writeAndFlush(new TextWebSocketFrame(json), promise));
        } catch (Exception e) {
            promise.setFailure(e);
        }
        return promise;
    }
}
