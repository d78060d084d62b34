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
import io.netty.buffer.Unpooled;
import org.slquery.protocol.ClientFlag;
import org.slquery.protocol.ClientHello;
import org.slquery.protocol.HandshakeResult;
import org.slquery.protocol.OutboundMessage;
import org.slquery.protocol.ServerHello;

import java.nio.charset.StandardCharsets;

/**
 * Serialization of protocol objects to {@link ByteBuf} according to the query wire protocol.
 * All integers are little-endian.
 */
public final class BytesSerializer {

    public static final int FRAME_LENGTH_BYTES = 4;

    private BytesSerializer() {}

    /**
     * Prefixes a payload with its length. The payload buffer is released.
     *
     * @param payload the frame payload
     * @return the complete frame
     */
    public static ByteBuf toFrame(ByteBuf payload) {
        int length = payload.readableBytes();
        ByteBuf frame = Unpooled.buffer(FRAME_LENGTH_BYTES + length);
        frame.writeIntLE(length);
        frame.writeBytes(payload, payload.readerIndex(), length);
        payload.release();
        return frame;
    }

    public static ByteBuf toBytes(OutboundMessage message) {
        byte[] content = message.content().getBytes(StandardCharsets.UTF_8);
        ByteBuf buffer = Unpooled.buffer(1 + content.length);
        buffer.writeByte(message.contentType().asCode());
        buffer.writeBytes(content);
        return buffer;
    }

    public static ByteBuf toBytes(ClientHello hello) {
        ByteBuf buffer = Unpooled.buffer();
        buffer.writeByte(hello.flags().toBits());
        buffer.writeLongLE(hello.permissions());
        buffer.writeByte(hello.kickPower());
        if (hello.flags().contains(ClientFlag.SPECIFY_LOG_USERNAME)) {
            writeShortString(buffer, hello.username().orElse(""));
        }
        buffer.writeByte(hello.proof().length);
        buffer.writeBytes(hello.proof());
        return buffer;
    }

    public static ByteBuf toBytes(ServerHello hello) {
        ByteBuf buffer = Unpooled.buffer(4 + hello.challenge().length);
        buffer.writeByte(hello.protocolVersion());
        buffer.writeShortLE(hello.maxPacketSize());
        buffer.writeByte(hello.challenge().length);
        buffer.writeBytes(hello.challenge());
        return buffer;
    }

    public static ByteBuf toBytes(HandshakeResult result) {
        ByteBuf buffer = Unpooled.buffer();
        buffer.writeByte(result.status().asCode());
        writeShortString(buffer, result.reason());
        return buffer;
    }

    static void writeShortString(ByteBuf buffer, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > 0xFFFF) {
            throw new IllegalArgumentException("String too long for a u16 length prefix: " + bytes.length);
        }
        buffer.writeShortLE(bytes.length);
        buffer.writeBytes(bytes);
    }
}
