package com.iksanov.coherentcache.core.metrics;

import com.iksanov.coherentcache.common.exception.CacheException;
import com.iksanov.coherentcache.core.config.CoherenceConfig;
import com.iksanov.coherentcache.core.store.AtomicStore;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * HTTP endpoint for Prometheus scraping ({@code /metrics}) and store health ({@code /health}).
 * Port 0 binds an ephemeral port, see {@link #boundPort()}.
 */
public class MetricsServer {

    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);
    private final int port;
    private final CoherenceMetrics metrics;
    private final AtomicStore store;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MetricsServer(int port, CoherenceMetrics metrics, AtomicStore store) {
        this.port = port;
        this.metrics = metrics;
        this.store = store;
    }

    public static MetricsServer fromConfig(CoherenceConfig config, CoherenceMetrics metrics, AtomicStore store) {
        return new MetricsServer(config.metricsPort(), metrics, store);
    }

    public void start() {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new HttpServerCodec())
                                    .addLast(new HttpObjectAggregator(64 * 1024))
                                    .addLast(new MetricsHandler(metrics, store));
                        }
                    })
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .childOption(ChannelOption.SO_KEEPALIVE, true);
            serverChannel = bootstrap.bind(port).sync().channel();
            log.info("Metrics server started on port {}", boundPort());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
            throw new CacheException("Interrupted while starting metrics server", e);
        } catch (Exception e) {
            log.error("Failed to start metrics server on port {}", port, e);
            shutdown();
            throw new CacheException("Failed to start metrics server on port " + port, e);
        }
    }

    public int boundPort() {
        if (serverChannel == null) throw new IllegalStateException("Metrics server is not running");
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void shutdown() {
        log.info("Shutting down metrics server...");
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully();
        if (bossGroup != null) bossGroup.shutdownGracefully();
        serverChannel = null;
        log.info("Metrics server shut down");
    }

    private static class MetricsHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        private final CoherenceMetrics metrics;
        private final AtomicStore store;

        MetricsHandler(CoherenceMetrics metrics, AtomicStore store) {
            this.metrics = metrics;
            this.store = store;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            String path = new QueryStringDecoder(request.uri()).path();
            if ("/metrics".equals(path)) {
                send(ctx, HttpResponseStatus.OK, metrics.scrape(), "text/plain; version=0.0.4; charset=utf-8");
            } else if ("/health".equals(path)) {
                handleHealth(ctx);
            } else {
                send(ctx, HttpResponseStatus.NOT_FOUND, "Not Found", "text/plain");
            }
        }

        private void handleHealth(ChannelHandlerContext ctx) {
            try {
                store.ping();
                send(ctx, HttpResponseStatus.OK, "{\"status\":\"UP\"}", "application/json");
            } catch (CacheException e) {
                log.warn("Health check failed: {}", e.getMessage());
                send(ctx, HttpResponseStatus.SERVICE_UNAVAILABLE, "{\"status\":\"DOWN\"}", "application/json");
            }
        }

        private void send(ChannelHandlerContext ctx, HttpResponseStatus status, String body, String contentType) {
            FullHttpResponse response = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1,
                    status,
                    Unpooled.copiedBuffer(body, StandardCharsets.UTF_8)
            );
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
            response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Error in metrics handler", cause);
            ctx.close();
        }
    }
}
