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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slquery.client.session.ConnectionListener;
import org.slquery.client.session.DisconnectReason;
import org.slquery.protocol.DecodedMessage;
import org.slquery.serde.MessageCodec;

/**
 * Decodes frames received after the handshake and hands them to the connection's listener.
 * Reports the end of the connection exactly once.
 */
final class QueryMessageHandler extends SimpleChannelInboundHandler<ByteBuf> {
    private static final Logger log = LoggerFactory.getLogger(QueryMessageHandler.class);

    private final QueryTcpConnection connection;
    private final ConnectionListener listener;
    private Throwable failure;
    private boolean reported;

    QueryMessageHandler(QueryTcpConnection connection, ConnectionListener listener) {
        this.connection = connection;
        this.listener = listener;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        DecodedMessage message = MessageCodec.decode(msg);
        log.trace("Received {} message ({} chars)", message.kind(), message.content().length());
        listener.onMessage(message);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (failure == null) {
            failure = cause;
        }
        log.debug("Closing connection to {} after error: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (!reported) {
            reported = true;
            listener.onDisconnected(reasonFor(), failure);
        }
        ctx.fireChannelInactive();
    }

    private DisconnectReason reasonFor() {
        if (connection.isClosedByClient()) {
            return DisconnectReason.CLIENT_INITIATED;
        }
        if (failure instanceof DecoderException) {
            return DisconnectReason.PROTOCOL_ERROR;
        }
        if (failure != null) {
            return DisconnectReason.NETWORK_ERROR;
        }
        return DisconnectReason.SERVER_CLOSED;
    }
}
