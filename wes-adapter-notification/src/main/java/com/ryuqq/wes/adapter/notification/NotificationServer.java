package com.ryuqq.wes.adapter.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wes.application.trigger.ReconcileQueue;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * 알림 수신 HTTP/1.1 서버 (Netty).
 *
 * <p>파이프라인: IdleStateHandler → HttpServerCodec → HttpObjectAggregator → {@link NotificationHandler}</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * NotificationServer server = new NotificationServer(config, scheduler);
 * int port = server.start();
 * ...
 * server.stop();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NotificationServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationServer.class);
    private static final int IDLE_TIMEOUT_SECONDS = 60;

    private final NotificationConfig config;
    private final NotificationHandler handler;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    /**
     * 생성자.
     *
     * @param config 설정
     * @param queue 수신한 Run ID를 넣을 큐
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public NotificationServer(NotificationConfig config, ReconcileQueue queue) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.handler = new NotificationHandler(queue, config.path(), new ObjectMapper());
    }

    /**
     * 서버 바인드.
     *
     * @return 실제 바인드된 포트
     * @throws IllegalStateException 바인드 실패 시
     */
    public synchronized int start() {
        if (serverChannel != null) {
            return port();
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .childOption(ChannelOption.TCP_NODELAY, true)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    pipeline.addLast(new IdleStateHandler(IDLE_TIMEOUT_SECONDS, 0, 0, TimeUnit.SECONDS));
                    pipeline.addLast(new HttpServerCodec());
                    pipeline.addLast(new HttpObjectAggregator(config.maxContentLength()));
                    pipeline.addLast(handler);
                }
            });

        // bind 실패 원인은 checked 예외(BindException)일 수 있으므로 future 결과로 판정
        ChannelFuture bound = bootstrap.bind(config.host(), config.port()).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            shutdownGroups();
            throw new IllegalStateException(
                String.format("Failed to bind notification server on %s:%d", config.host(), config.port()),
                bound.cause()
            );
        }
        serverChannel = bound.channel();
        log.info("Notification server listening on {}:{}{}", config.host(), port(), config.path());
        return port();
    }

    /**
     * 바인드된 포트.
     *
     * @return 포트
     * @throws IllegalStateException 시작 전인 경우
     */
    public synchronized int port() {
        if (serverChannel == null) {
            throw new IllegalStateException("Notification server is not running");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized boolean isRunning() {
        return serverChannel != null;
    }

    /**
     * 서버 종료.
     */
    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        try {
            serverChannel.close().syncUninterruptibly();
        } finally {
            serverChannel = null;
            shutdownGroups();
            log.info("Notification server stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            bossGroup = null;
        }
    }
}
