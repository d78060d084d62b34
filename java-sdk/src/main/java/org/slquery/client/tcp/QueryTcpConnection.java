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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slquery.client.session.QueryConnection;
import org.slquery.exception.QueryConnectionLostException;
import org.slquery.exception.QueryProtocolUsageException;
import org.slquery.serde.BytesSerializer;

import java.util.concurrent.CompletableFuture;

/**
 * A Netty channel that completed the handshake.
 */
final class QueryTcpConnection implements QueryConnection {
    private static final Logger log = LoggerFactory.getLogger(QueryTcpConnection.class);

    private final Channel channel;
    private volatile int maxPacketSize;
    private volatile boolean closedByClient;

    QueryTcpConnection(Channel channel) {
        this.channel = channel;
    }

    /**
     * Limits outgoing payloads to the size the server announced. Zero means no limit.
     */
    void setMaxPacketSize(int maxPacketSize) {
        this.maxPacketSize = maxPacketSize;
    }

    int maxPacketSize() {
        return maxPacketSize;
    }

    boolean isClosedByClient() {
        return closedByClient;
    }

    @Override
    public CompletableFuture<Void> send(ByteBuf payload) {
        if (!channel.isActive()) {
            payload.release();
            return CompletableFuture.failedFuture(
                    new QueryConnectionLostException("Connection to " + remoteAddress() + " is closed"));
        }
        int payloadSize = payload.readableBytes();
        int limit = maxPacketSize;
        if (limit > 0 && payloadSize > limit) {
            payload.release();
            return CompletableFuture.failedFuture(new QueryProtocolUsageException(
                    "Message of " + payloadSize + " bytes exceeds the server's maximum packet size of " + limit));
        }

        ByteBuf frame = BytesSerializer.toFrame(payload);
        if (log.isTraceEnabled()) {
            log.trace(
                    "Sending frame with payload size: {}, total frame size: {} to {}",
                    payloadSize,
                    frame.readableBytes(),
                    remoteAddress());
            log.trace("Frame bytes (hex): {}", ByteBufUtil.hexDump(frame, 0, Math.min(frame.readableBytes(), 64)));
        }

        CompletableFuture<Void> sent = new CompletableFuture<>();
        channel.writeAndFlush(frame).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                sent.complete(null);
            } else {
                log.error("Failed to send frame: {}", future.cause().getMessage());
                sent.completeExceptionally(new QueryConnectionLostException("Failed to send frame", future.cause()));
            }
        });
        return sent;
    }

    @Override
    public boolean isActive() {
        return channel.isActive();
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.remoteAddress());
    }

    @Override
    public CompletableFuture<Void> close() {
        closedByClient = true;
        CompletableFuture<Void> closed = new CompletableFuture<>();
        channel.close().addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                closed.complete(null);
            } else {
                closed.completeExceptionally(future.cause());
            }
        });
        return closed;
    }
}
