package com.marketchat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketchat.gateway.config.GatewayProperties;
import com.marketchat.gateway.session.SessionRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class NettyWsServer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(NettyWsServer.class);

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final SessionRegistry sessionRegistry;
    private final WsEventDispatcher dispatcher;
    private final WsPresenceService presenceService;
    private final WsWriter wsWriter;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         ObjectMapper objectMapper,
                         SessionRegistry sessionRegistry,
                         WsEventDispatcher dispatcher,
                         WsPresenceService presenceService,
                         WsWriter wsWriter) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.sessionRegistry = sessionRegistry;
        this.dispatcher = dispatcher;
        this.presenceService = presenceService;
        this.wsWriter = wsWriter;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        String host = props.hostEffective();
        String path = props.pathEffective();
        log.info("Starting Netty WS gateway on {}:{}{}", host, props.port(), path);

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

                        // 1) HTTP 编解码 + 聚合：握手阶段是 HTTP
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(65536));

                        // 2) 空闲检测：读空闲关连接，写空闲发 ping 并刷新路由 TTL
                        p.addLast(new IdleStateHandler(props.readerIdleSecondsEffective(),
                                props.writerIdleSecondsEffective(), 0));

                        // 3) 握手身份：userid 头 / userId 参数 -> 绑定 channel
                        p.addLast(new WsHandshakeAuthHandler(path, sessionRegistry));

                        // 4) WebSocket 协议：握手 upgrade + 协议层 ping/pong
                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(path)
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        // 5) 业务帧：JSON 文本事件
                        p.addLast(new WsFrameHandler(objectMapper, sessionRegistry, dispatcher, presenceService, wsWriter));
                    }
                });

        try {
            serverChannel = b.bind(host, props.port()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", host, props.port(), path, e);
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
        return Integer.MIN_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }
}
