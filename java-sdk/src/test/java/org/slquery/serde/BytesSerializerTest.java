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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slquery.protocol.ClientFlag;
import org.slquery.protocol.ClientFlags;
import org.slquery.protocol.ClientHello;
import org.slquery.protocol.HandshakeResult;
import org.slquery.protocol.HandshakeStatus;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BytesSerializerTest {

    @Nested
    class Frame {

        @Test
        void shouldPrefixPayloadWithLittleEndianLength() {
            // given
            ByteBuf payload = Unpooled.wrappedBuffer(new byte[] {9, 8, 7});

            // when
            ByteBuf frame = BytesSerializer.toFrame(payload);

            // then
            assertThat(frame.readableBytes()).isEqualTo(4 + 3);
            assertThat(frame.readIntLE()).isEqualTo(3);
            assertThat(frame.readByte()).isEqualTo((byte) 9);
            assertThat(payload.refCnt()).isZero();
        }

        @Test
        void shouldFrameEmptyPayload() {
            // when
            ByteBuf frame = BytesSerializer.toFrame(Unpooled.buffer(0));

            // then
            assertThat(frame.readableBytes()).isEqualTo(4);
            assertThat(frame.readIntLE()).isZero();
        }
    }

    @Nested
    class ClientHelloEncoding {

        @Test
        void shouldOmitUsernameWithoutFlag() {
            // given
            byte[] proof = new byte[32];
            ClientHello hello = new ClientHello(
                    ClientFlags.of(ClientFlag.SUBSCRIBE_SERVER_CONSOLE), -1L, 255, Optional.of("ignored"), proof);

            // when
            ByteBuf buffer = BytesSerializer.toBytes(hello);

            // then
            assertThat(buffer.readUnsignedByte()).isEqualTo(0x02);
            assertThat(buffer.readLongLE()).isEqualTo(-1L);
            assertThat(buffer.readUnsignedByte()).isEqualTo(255);
            assertThat(buffer.readUnsignedByte()).isEqualTo(32);
            assertThat(buffer.readableBytes()).isEqualTo(32);
        }

        @Test
        void shouldWriteUsernameWithFlag() {
            // given
            ClientHello hello = new ClientHello(
                    ClientFlags.of(ClientFlag.SPECIFY_LOG_USERNAME, ClientFlag.RESTRICT_PERMISSIONS),
                    0x0FL,
                    10,
                    Optional.of("admin"),
                    new byte[] {1});

            // when
            ByteBuf buffer = BytesSerializer.toBytes(hello);

            // then
            assertThat(buffer.readUnsignedByte()).isEqualTo(0x30);
            assertThat(buffer.readLongLE()).isEqualTo(0x0FL);
            assertThat(buffer.readUnsignedByte()).isEqualTo(10);
            assertThat(buffer.readUnsignedShortLE()).isEqualTo(5);
            assertThat(buffer.readCharSequence(5, StandardCharsets.UTF_8).toString()).isEqualTo("admin");
            assertThat(buffer.readUnsignedByte()).isEqualTo(1);
            assertThat(buffer.readByte()).isEqualTo((byte) 1);
            assertThat(buffer.isReadable()).isFalse();
        }
    }

    @Nested
    class HandshakeResultEncoding {

        @Test
        void shouldWriteRejectedStatusAsNonZeroNonOne() {
            // when
            ByteBuf buffer = BytesSerializer.toBytes(new HandshakeResult(HandshakeStatus.REJECTED, "banned"));

            // then
            assertThat(buffer.readUnsignedByte()).isEqualTo(0xFF);
            assertThat(BytesDeserializer.readShortString(buffer, "reason")).isEqualTo("banned");
        }
    }

    @Test
    void shouldRejectStringsLongerThanU16() {
        // given
        String tooLong = "x".repeat(0x10000);

        // then
        assertThatThrownBy(() -> BytesSerializer.writeShortString(Unpooled.buffer(), tooLong))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
