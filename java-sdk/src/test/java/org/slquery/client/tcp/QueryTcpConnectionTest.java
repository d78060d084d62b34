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
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slquery.exception.QueryConnectionLostException;
import org.slquery.exception.QueryProtocolUsageException;
import org.slquery.protocol.ContentTypeToServer;
import org.slquery.serde.MessageCodec;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTcpConnectionTest {

    private static final Duration WAIT = Duration.ofSeconds(1);

    private EmbeddedChannel channel;
    private QueryTcpConnection connection;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel();
        connection = new QueryTcpConnection(channel);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    @Test
    void shouldWriteLengthPrefixedFrame() {
        // when
        CompletableFuture<Void> sent = connection.send(MessageCodec.encode("/players", ContentTypeToServer.COMMAND));

        // then
        assertThat(sent).succeedsWithin(WAIT);
        ByteBuf frame = channel.readOutbound();
        assertThat(frame.readIntLE()).isEqualTo(9);
        assertThat(frame.readUnsignedByte()).isZero();
        assertThat(frame.toString(StandardCharsets.UTF_8)).isEqualTo("/players");
        frame.release();
    }

    @Test
    void shouldRejectPayloadAboveServerLimit() {
        // given
        connection.setMaxPacketSize(4);
        ByteBuf payload = MessageCodec.encode("/players", ContentTypeToServer.COMMAND);

        // when
        CompletableFuture<Void> sent = connection.send(payload);

        // then
        assertThat(sent)
                .failsWithin(WAIT)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(QueryProtocolUsageException.class);
        assertThat(payload.refCnt()).isZero();
        assertThat((Object) channel.readOutbound()).isNull();
    }

    @Test
    void shouldFailOnClosedChannel() {
        // given
        channel.close();

        // when
        CompletableFuture<Void> sent = connection.send(MessageCodec.encode("/players", ContentTypeToServer.COMMAND));

        // then
        assertThat(sent)
                .failsWithin(WAIT)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(QueryConnectionLostException.class);
    }

    @Test
    void closeShouldBeIdempotentAndMarkedAsClientInitiated() {
        // when
        connection.close();
        CompletableFuture<Void> second = connection.close();

        // then
        assertThat(second).succeedsWithin(WAIT);
        assertThat(connection.isClosedByClient()).isTrue();
        assertThat(connection.isActive()).isFalse();
    }
}
