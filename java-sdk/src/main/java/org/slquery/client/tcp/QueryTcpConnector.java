/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.slquery.client.tcp;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slquery.client.session.ConnectionListener;
import org.slquery.client.session.QueryConnection;
import org.slquery.client.session.QueryConnector;
import org.slquery.config.ConnectionSettings;
import org.slquery.exception.QueryClientException;
import org.slquery.exception.QueryConnectionLostException;
import org.slquery.protocol.ServerHello;

import javax.net.ssl.SSLException;
import java.util.concurrent.CompletableFuture;

/**
 * Opens TCP connections to a query server using Netty for non-blocking I/O.
 *
 * <p>Every attempt gets a fresh channel and pipeline:
 * {@code [ssl] -> frameDecoder -> handshake -> messageHandler}. The handshake handler holds back
 * all events until the server accepts the client, so the listener only ever sees connections
 * that are ready.
 */
public final class QueryTcpConnector implements QueryConnector {
    private static final Logger log = LoggerFactory.getLogger(QueryTcpConnector.class);

    private final ConnectionSettings settings;
    private final SslContext sslContext;
    private final Bootstrap bootstrap;

    public QueryTcpConnector(ConnectionSettings settings, EventLoopGroup eventLoopGroup) {
        this.settings = settings;
        if (settings.enableTls()) {
            try {
                SslContextBuilder builder = SslContextBuilder.forClient();
                settings.tlsCertificate().ifPresent(builder::trustManager);
                this.sslContext = builder.build();
            } catch (SSLException e) {
                throw new QueryClientException("Failed to build SSL context", e);
            }
        } else {
            this.sslContext = null;
        }
        this.bootstrap = new Bootstrap()
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.connectionTimeout().toMillis());
    }

    @Override
    public CompletableFuture<QueryConnection> connect(ConnectionListener listener) {
        CompletableFuture<QueryConnection> result = new CompletableFuture<>();
        ConnectAttempt attempt = new ConnectAttempt(listener);

        log.debug("Connecting to {}:{}", settings.host(), settings.port());
        bootstrap.clone()
                .handler(attempt)
                .connect(settings.host(), settings.port())
                .addListener((ChannelFutureListener) channelFuture -> {
                    if (!channelFuture.isSuccess()) {
                        attempt.handshake.completeExceptionally(new QueryConnectionLostException(
                                "Failed to connect to " + settings.host() + ":" + settings.port(),
                                channelFuture.cause()));
                    }
                });

        attempt.handshake.whenComplete((serverHello, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                attempt.connection.setMaxPacketSize(serverHello.maxPacketSize());
                result.complete(attempt.connection);
            }
        });
        return result;
    }

    private final class ConnectAttempt extends ChannelInitializer<SocketChannel> {
        private final ConnectionListener listener;
        private final CompletableFuture<ServerHello> handshake = new CompletableFuture<>();
        private volatile QueryTcpConnection connection;

        ConnectAttempt(ConnectionListener listener) {
            this.listener = listener;
        }

        @Override
        protected void initChannel(SocketChannel ch) {
            connection = new QueryTcpConnection(ch);
            ChannelPipeline pipeline = ch.pipeline();

            if (sslContext != null) {
                pipeline.addLast("ssl", sslContext.newHandler(ch.alloc(), settings.host(), settings.port()));
            }

            pipeline.addLast("frameDecoder", new QueryFrameDecoder(settings.maxFrameSize()));
            pipeline.addLast("handshake", new HandshakeHandler(settings, handshake));
            pipeline.addLast("messageHandler", new QueryMessageHandler(connection, listener));
        }
    }
}
