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

package org.slquery.client.session;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SendPermitTest {

    @Test
    void shouldGrantPermitInAcquisitionOrder() {
        // given
        SendPermit permit = new SendPermit();

        // when
        CompletableFuture<Runnable> first = permit.acquire();
        CompletableFuture<Runnable> second = permit.acquire();
        CompletableFuture<Runnable> third = permit.acquire();

        // then
        assertThat(first).isDone();
        assertThat(second).isNotDone();

        first.join().run();
        assertThat(second).isDone();
        assertThat(third).isNotDone();

        second.join().run();
        assertThat(third).isDone();
    }

    @Test
    void releasingTwiceShouldNotSkipHolders() {
        // given
        SendPermit permit = new SendPermit();
        Runnable release = permit.acquire().join();
        CompletableFuture<Runnable> second = permit.acquire();
        CompletableFuture<Runnable> third = permit.acquire();

        // when
        release.run();
        release.run();

        // then
        assertThat(second).isDone();
        assertThat(third).isNotDone();
    }

    @Test
    void holdersReleasingOnGrantShouldNotNestHandOffs() {
        // given
        SendPermit permit = new SendPermit();
        Runnable first = permit.acquire().join();
        AtomicInteger depth = new AtomicInteger();
        AtomicInteger maxDepth = new AtomicInteger();
        List<CompletableFuture<Void>> holders = new ArrayList<>();
        for (int i = 0; i < 100_000; i++) {
            holders.add(permit.acquire().thenAccept(release -> {
                maxDepth.accumulateAndGet(depth.incrementAndGet(), Math::max);
                release.run();
                depth.decrementAndGet();
            }));
        }

        // when
        first.run();

        // then
        assertThat(holders).allMatch(CompletableFuture::isDone);
        assertThat(maxDepth.get()).isEqualTo(1);
        assertThat(permit.acquire()).isDone();
    }
}
