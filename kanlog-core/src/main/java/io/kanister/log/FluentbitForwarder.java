/*
 * The MIT License
 *
 * Copyright 2025 The Kanister Authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.kanister.log;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Ships entries as JSON lines to a Fluent Bit TCP input.
 * <p>
 * The connection is opened in the background on the first entry and re-opened
 * the same way after it drops. Callers never wait for it: entries arriving
 * while a connect is in flight are held in a bounded backlog and written once
 * the channel is up. Nothing is retried: when the connect fails the backlog is
 * lost, and failures are only reported at debug level.
 */
public class FluentbitForwarder implements LogHook {

    private static final Logger logger = LoggerFactory.getLogger(FluentbitForwarder.class);

    static final int CONNECT_TIMEOUT_MILLIS = 2000;
    static final int MAX_BACKLOG = 1024;

    private final String host;
    private final int port;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    // backlog guarded by this
    private final List<byte[]> backlog = new ArrayList<>();
    private volatile ChannelFuture connecting;

    private volatile Channel channel;
    private volatile boolean closed;

    public FluentbitForwarder(String host, int port) {
        this.host = host;
        this.port = port;
        group = new NioEventLoopGroup(1, new DefaultThreadFactory("kanlog-fluentbit", true));
        bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new ChannelInboundHandlerAdapter() {
                            @Override
                            public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
                                logger.debug("fluentbit connection {}:{} failed: {}", host, port, cause.getMessage());
                                ctx.close();
                            }
                        });
                    }
                });
    }

    @Override
    public void fire(LogEntry entry) {
        if (closed) {
            return;
        }
        byte[] line;
        try {
            line = (JsonFormatter.toJson(entry) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (LogException e) {
            logger.debug("not forwarding entry: {}", e.getMessage());
            return;
        }
        Channel ch = channel;
        if (ch != null && ch.isActive() && connecting == null) {
            write(ch, line);
            return;
        }
        synchronized (this) {
            if (closed) {
                return;
            }
            ch = channel;
            if (ch != null && ch.isActive() && connecting == null) {
                write(ch, line);
                return;
            }
            if (backlog.size() < MAX_BACKLOG) {
                backlog.add(line);
            } else {
                logger.debug("fluentbit backlog full, dropping entry");
            }
            if (connecting == null) {
                connecting = bootstrap.connect(host, port);
                connecting.addListener((ChannelFutureListener) this::connected);
            }
        }
    }

    private synchronized void connected(ChannelFuture future) {
        connecting = null;
        if (!future.isSuccess()) {
            logger.debug("unable to connect to fluentbit {}:{}, dropping {} entries: {}", host, port, backlog.size(),
                    future.cause() == null ? "" : future.cause().getMessage());
            backlog.clear();
            return;
        }
        if (closed) {
            backlog.clear();
            future.channel().close();
            return;
        }
        channel = future.channel();
        logger.debug("connected to fluentbit {}:{}", host, port);
        for (byte[] line : backlog) {
            write(channel, line);
        }
        backlog.clear();
    }

    private void write(Channel ch, byte[] line) {
        ch.writeAndFlush(Unpooled.wrappedBuffer(line)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                logger.debug("fluentbit write to {}:{} failed: {}", host, port, f.cause() == null ? "" : f.cause().getMessage());
            }
        });
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public boolean isConnected() {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            backlog.clear();
        }
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly(CONNECT_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

}
