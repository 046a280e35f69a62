package com.teamchat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.auth.service.JwtService;
import com.teamchat.gateway.config.GatewayProperties;
import com.teamchat.gateway.session.SessionRegistry;
import com.teamchat.gateway.session.TopicSubscriptionRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
public class NettyWsServer implements SmartLifecycle {

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;
    private final TopicSubscriptionRegistry subscriptions;
    private final WsWriter wsWriter;
    private final WsSessionBootstrapper bootstrapper;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         ObjectMapper objectMapper,
                         JwtService jwtService,
                         SessionRegistry sessionRegistry,
                         TopicSubscriptionRegistry subscriptions,
                         WsWriter wsWriter,
                         WsSessionBootstrapper bootstrapper) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.jwtService = jwtService;
        this.sessionRegistry = sessionRegistry;
        this.subscriptions = subscriptions;
        this.wsWriter = wsWriter;
        this.bootstrapper = bootstrapper;
    }

    @Override
    public void start() {
        if (!props.enabledEffective()) {
            log.info("Netty WS gateway disabled (chat.gateway.ws.enabled=false)");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        String path = props.pathEffective();
        log.info("Starting Netty WS gateway on {}:{}{}", props.host(), props.port(), path);

        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        // 握手阶段是 HTTP
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        // 60s 没有写出任何数据就发一次应用层 PING
                        p.addLast(new IdleStateHandler(0, 60, 0));
                        p.addLast(new WsHandshakeAuthHandler(path, jwtService, sessionRegistry));
                        p.addLast(new WebSocketServerProtocolHandler(WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(path)
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .build()));
                        p.addLast(new WsFrameHandler(objectMapper, wsWriter, sessionRegistry, subscriptions, bootstrapper));
                    }
                });

        try {
            serverChannel = b.bind(props.host(), props.port()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", props.host(), props.port(), path, e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping Netty WS gateway...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("Netty WS gateway stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 晚于 Spring MVC 与 Redis 监听启动，早停
        return Integer.MAX_VALUE - 1;
    }
}
