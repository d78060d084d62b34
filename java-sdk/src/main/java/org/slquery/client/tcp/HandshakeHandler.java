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
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slquery.config.ConnectionSettings;
import org.slquery.exception.QueryAuthenticationException;
import org.slquery.exception.QueryConnectionLostException;
import org.slquery.exception.QueryException;
import org.slquery.exception.QueryHandshakeException;
import org.slquery.protocol.ClientHello;
import org.slquery.protocol.HandshakeResult;
import org.slquery.protocol.PasswordProof;
import org.slquery.protocol.ServerHello;
import org.slquery.serde.BytesDeserializer;
import org.slquery.serde.BytesSerializer;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the client side of the handshake on a fresh channel:
 * <ol>
 *   <li>reads the server hello and checks the protocol version,</li>
 *   <li>answers with the client hello carrying the flags, the requested rights and the password
 *       proof,</li>
 *   <li>reads the handshake result.</li>
 * </ol>
 *
 * <p>On acceptance the handler removes itself, so later frames reach the message handler, and
 * completes the future with the server hello. On any failure it closes the channel and fails the
 * future. Channel closure is never propagated past this handler: a connection that never
 * completed the handshake is reported through the future only.
 */
final class HandshakeHandler extends SimpleChannelInboundHandler<ByteBuf> {
    private static final Logger log = LoggerFactory.getLogger(HandshakeHandler.class);

    static final int PROTOCOL_VERSION = 1;

    private enum Phase {
        AWAITING_SERVER_HELLO,
        AWAITING_RESULT,
        DONE
    }

    private final ConnectionSettings settings;
    private final CompletableFuture<ServerHello> result;
    private Phase phase = Phase.AWAITING_SERVER_HELLO;
    private ServerHello serverHello;
    private ScheduledFuture<?> timeout;

    HandshakeHandler(ConnectionSettings settings, CompletableFuture<ServerHello> result) {
        this.settings = settings;
        this.result = result;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        long timeoutMillis = settings.handshakeTimeout().toMillis();
        timeout = ctx.executor()
                .schedule(
                        () -> fail(ctx, new QueryHandshakeException("Not completed within " + timeoutMillis + " ms")),
                        timeoutMillis,
                        TimeUnit.MILLISECONDS);
        result.whenComplete((hello, error) -> timeout.cancel(false));
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        try {
            switch (phase) {
                case AWAITING_SERVER_HELLO:
                    onServerHello(ctx, msg);
                    break;
                case AWAITING_RESULT:
                    onHandshakeResult(ctx, msg);
                    break;
                default:
                    ctx.fireChannelRead(msg.retain());
            }
        } catch (QueryException e) {
            fail(ctx, e);
        }
    }

    private void onServerHello(ChannelHandlerContext ctx, ByteBuf msg) {
        ServerHello hello = BytesDeserializer.readServerHello(msg);
        if (hello.protocolVersion() != PROTOCOL_VERSION) {
            throw new QueryHandshakeException("Unsupported protocol version " + hello.protocolVersion()
                    + ", expected " + PROTOCOL_VERSION);
        }
        log.debug(
                "Server hello: version={}, maxPacketSize={}, challenge={} bytes",
                hello.protocolVersion(),
                hello.maxPacketSize(),
                hello.challenge().length);
        serverHello = hello;

        byte[] proof = PasswordProof.compute(settings.password(), hello.challenge());
        ClientHello clientHello = new ClientHello(
                settings.flags(), settings.permissions(), settings.kickPower(), settings.username(), proof);
        phase = Phase.AWAITING_RESULT;
        ctx.writeAndFlush(BytesSerializer.toFrame(BytesSerializer.toBytes(clientHello)));
    }

    private void onHandshakeResult(ChannelHandlerContext ctx, ByteBuf msg) {
        HandshakeResult handshakeResult = BytesDeserializer.readHandshakeResult(msg);
        switch (handshakeResult.status()) {
            case ACCEPTED:
                phase = Phase.DONE;
                ctx.pipeline().remove(this);
                log.debug("Handshake accepted by {}", ctx.channel().remoteAddress());
                result.complete(serverHello);
                break;
            case REJECTED_PASSWORD:
                throw new QueryAuthenticationException(handshakeResult.reason());
            default:
                throw new QueryHandshakeException(handshakeResult.reason());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        fail(ctx, new QueryConnectionLostException("Connection closed during handshake"));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            fail(ctx, new QueryHandshakeException(cause.getMessage()));
        } else {
            fail(ctx, new QueryConnectionLostException("Connection failed during handshake", cause));
        }
    }

    private void fail(ChannelHandlerContext ctx, QueryException error) {
        if (phase == Phase.DONE) {
            return;
        }
        phase = Phase.DONE;
        log.debug("Handshake failed: {}", error.getMessage());
        ctx.close();
        result.completeExceptionally(error);
    }
}
