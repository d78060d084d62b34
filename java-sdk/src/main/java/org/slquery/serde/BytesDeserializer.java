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
import org.slquery.exception.QueryHandshakeException;
import org.slquery.protocol.HandshakeResult;
import org.slquery.protocol.HandshakeStatus;
import org.slquery.protocol.ServerHello;

import java.nio.charset.StandardCharsets;

/**
 * Deserialization of handshake frames. A frame that is too short for its declared fields is a
 * handshake protocol violation.
 */
public final class BytesDeserializer {

    private BytesDeserializer() {}

    public static ServerHello readServerHello(ByteBuf response) {
        requireReadable(response, 4, "server hello");
        int version = response.readUnsignedByte();
        int maxPacketSize = response.readUnsignedShortLE();
        int challengeLength = response.readUnsignedByte();
        requireReadable(response, challengeLength, "server challenge");
        byte[] challenge = new byte[challengeLength];
        response.readBytes(challenge);
        return new ServerHello(version, maxPacketSize, challenge);
    }

    public static HandshakeResult readHandshakeResult(ByteBuf response) {
        requireReadable(response, 3, "handshake result");
        var status = HandshakeStatus.fromCode(response.readUnsignedByte());
        var reason = readShortString(response, "handshake reason");
        return new HandshakeResult(status, reason);
    }

    static String readShortString(ByteBuf response, String what) {
        requireReadable(response, 2, what);
        int length = response.readUnsignedShortLE();
        requireReadable(response, length, what);
        return response.readCharSequence(length, StandardCharsets.UTF_8).toString();
    }

    private static void requireReadable(ByteBuf response, int bytes, String what) {
        if (response.readableBytes() < bytes) {
            throw new QueryHandshakeException("Truncated " + what + ": expected " + bytes + " bytes, got "
                    + response.readableBytes());
        }
    }
}
