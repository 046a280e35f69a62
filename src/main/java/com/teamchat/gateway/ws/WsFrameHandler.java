package com.teamchat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.gateway.session.SessionRegistry;
import com.teamchat.gateway.session.TopicSubscriptionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * 业务帧处理（JSON 文本协议）。发消息走 HTTP，WS 只负责订阅、心跳与输入中提示。
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private final ObjectMapper objectMapper;
    private final WsWriter wsWriter;
    private final SessionRegistry sessionRegistry;
    private final TopicSubscriptionRegistry subscriptions;
    private final WsSessionBootstrapper bootstrapper;

    public WsFrameHandler(ObjectMapper objectMapper,
                          WsWriter wsWriter,
                          SessionRegistry sessionRegistry,
                          TopicSubscriptionRegistry subscriptions,
                          WsSessionBootstrapper bootstrapper) {
        this.objectMapper = objectMapper;
        this.wsWriter = wsWriter;
        this.sessionRegistry = sessionRegistry;
        this.subscriptions = subscriptions;
        this.bootstrapper = bootstrapper;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            bootstrapper.bootstrap(ctx.channel());
            return;
        }
        if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.WRITER_IDLE) {
            // 应用层心跳，顺便续期在线路由
            wsWriter.write(ctx.channel(), WsEnvelope.of(WsEnvelope.PING));
            sessionRegistry.touch(ctx.channel());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        Channel ch = ctx.channel();
        WsEnvelope env;
        try {
            env = objectMapper.readValue(frame.text(), WsEnvelope.class);
        } catch (Exception e) {
            wsWriter.writeError(ch, "bad_json");
            return;
        }
        String type = env.getType() == null ? "" : env.getType().toUpperCase();
        if (WsEnvelope.PING.equals(type)) {
            sessionRegistry.touch(ch);
            wsWriter.write(ch, WsEnvelope.of(WsEnvelope.PONG));
            return;
        }
        if (WsEnvelope.PONG.equals(type)) {
            return;
        }
        if (!sessionRegistry.isBound(ch)) {
            wsWriter.writeError(ch, "not_ready");
            return;
        }
        switch (type) {
            case WsEnvelope.SUBSCRIBE -> bootstrapper.subscribe(ch, env.getTopic());
            case WsEnvelope.UNSUBSCRIBE -> bootstrapper.unsubscribe(ch, env.getTopic());
            case WsEnvelope.TYPING -> bootstrapper.typing(ch, env.getChannelId(), env.getTyping() == null || env.getTyping());
            default -> wsWriter.writeError(ch, "unknown_type");
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        subscriptions.unsubscribeAll(ctx.channel());
        sessionRegistry.unbind(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("ws channel error, closing: ch={}, err={}", ctx.channel().id().asShortText(), cause.toString());
        ctx.close();
    }
}
