package org.arpha.conduit.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.http.routing.Application;
import org.arpha.conduit.http.routing.DispatcherHandler;
import org.arpha.conduit.server.dto.ServerProperties;

import java.net.InetSocketAddress;

/**
 * Serves an {@link Application} over HTTP/1.1.
 */
@Slf4j
public class ConduitHttp implements AutoCloseable {

    private final DispatcherHandler dispatcher;
    private final ServerProperties properties;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public ConduitHttp(Application application, ServerProperties properties) {
        this.dispatcher = new DispatcherHandler(application);
        this.properties = properties;
    }

    /**
     * Binds the configured host and port and returns once the socket is listening.
     * Port {@code 0} binds an ephemeral port, see {@link #port()}.
     */
    public synchronized ConduitHttp bind() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already bound to port " + port());
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<>() {
                        @Override
                        protected void initChannel(Channel ch) {
                            ChannelPipeline pipeline = ch.pipeline();
                            pipeline.addLast("codec", new HttpServerCodec());
                            pipeline.addLast("aggregator", new HttpObjectAggregator(properties.getMaxContentLength()));
                            pipeline.addLast("handler", dispatcher);
                        }
                    });

            serverChannel = bootstrap.bind(properties.getHost(), properties.getPort()).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdown();
            throw e;
        }
        log.info("HTTP server listening on {}:{}", properties.getHost(), port());
        return this;
    }

    /**
     * Binds and blocks until the server channel is closed.
     */
    public void start() throws InterruptedException {
        bind();
        try {
            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    public int port() {
        if (serverChannel == null) {
            throw new IllegalStateException("Server is not bound");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Override
    public synchronized void close() {
        if (serverChannel != null) {
            log.info("Stopping HTTP server on port {}", port());
            serverChannel.close().syncUninterruptibly();
        }
        shutdown();
    }

    private synchronized void shutdown() {
        serverChannel = null;
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

}
