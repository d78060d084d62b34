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

package org.slquery.serde;

import io.netty.buffer.ByteBuf;
import org.slquery.protocol.ContentTypeToServer;
import org.slquery.protocol.DecodedMessage;
import org.slquery.protocol.OutboundMessage;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Encodes and decodes the payload of post-handshake frames: a one byte content type followed
 * by UTF-8 text.
 *
 * <p>Decoding never throws. Payloads the client cannot route come back as
 * {@link DecodedMessage.Kind#UNRECOGNIZED}.
 */
public final class MessageCodec {

    private MessageCodec() {}

    public static ByteBuf encode(String content, ContentTypeToServer contentType) {
        return BytesSerializer.toBytes(new OutboundMessage(contentType, content));
    }

    public static DecodedMessage decode(ByteBuf payload) {
        if (!payload.isReadable()) {
            return DecodedMessage.unrecognized(-1);
        }
        int contentType = payload.readUnsignedByte();
        String content = payload.readCharSequence(payload.readableBytes(), StandardCharsets.UTF_8).toString();
        return DecodedMessage.of(contentType, content);
    }

    /**
     * Decodes a frame produced by {@link #encode(String, ContentTypeToServer)}, as the server
     * does.
     *
     * @param payload the frame payload
     * @return the message, or empty if the payload is empty or its content type is unknown
     */
    public static Optional<OutboundMessage> decodeOutbound(ByteBuf payload) {
        if (!payload.isReadable()) {
            return Optional.empty();
        }
        int code = payload.readUnsignedByte();
        for (ContentTypeToServer type : ContentTypeToServer.values()) {
            if (type.asCode() == code) {
                String content = payload.readCharSequence(payload.readableBytes(), StandardCharsets.UTF_8)
                        .toString();
                return Optional.of(new OutboundMessage(type, content));
            }
        }
        return Optional.empty();
    }
}
