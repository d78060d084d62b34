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

package org.slquery.protocol;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClientFlagsTest {

    @Nested
    class Encoding {

        @Test
        void shouldEncodeNoFlagsAsZero() {
            assertThat(ClientFlags.none().toBits()).isZero();
        }

        @Test
        void shouldCombineMasks() {
            // given
            ClientFlags flags = ClientFlags.of(
                    ClientFlag.SUBSCRIBE_SERVER_CONSOLE, ClientFlag.SUBSCRIBE_SERVER_LOGS, ClientFlag.SPECIFY_LOG_USERNAME);

            // then
            assertThat(flags.toBits()).isEqualTo(0x02 | 0x04 | 0x20);
        }

        @Test
        void shouldDecodeKnownBitsAndIgnoreOthers() {
            // when
            ClientFlags flags = ClientFlags.fromBits(0x01 | 0x10 | 0x80);

            // then
            assertThat(flags.asSet())
                    .containsExactlyInAnyOrder(ClientFlag.SUPPRESS_COMMAND_RESPONSES, ClientFlag.RESTRICT_PERMISSIONS);
        }
    }

    @Nested
    class Immutability {

        @Test
        void withShouldReturnNewInstance() {
            // given
            ClientFlags original = ClientFlags.none();

            // when
            ClientFlags extended = original.with(ClientFlag.SUBSCRIBE_SERVER_CONSOLE);

            // then
            assertThat(original.contains(ClientFlag.SUBSCRIBE_SERVER_CONSOLE)).isFalse();
            assertThat(extended.contains(ClientFlag.SUBSCRIBE_SERVER_CONSOLE)).isTrue();
        }

        @Test
        void withExistingFlagShouldReturnSameInstance() {
            // given
            ClientFlags flags = ClientFlags.of(ClientFlag.SUBSCRIBE_SERVER_LOGS);

            // then
            assertThat(flags.with(ClientFlag.SUBSCRIBE_SERVER_LOGS)).isSameAs(flags);
        }

        @Test
        void shouldCompareByContent() {
            assertThat(ClientFlags.none().with(ClientFlag.SUBSCRIBE_SERVER_LOGS))
                    .isEqualTo(ClientFlags.fromBits(0x04))
                    .hasSameHashCodeAs(ClientFlags.of(ClientFlag.SUBSCRIBE_SERVER_LOGS));
        }
    }
}
