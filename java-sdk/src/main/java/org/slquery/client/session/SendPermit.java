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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asynchronous mutual exclusion: grants the permit to one holder at a time, in acquisition
 * order, without blocking any thread.
 *
 * <p>Hand-offs run in a loop on the releasing thread. A holder that releases from inside its
 * grant callback does not nest the next grant on the stack.
 */
final class SendPermit {

    private final Deque<CompletableFuture<Runnable>> waiters = new ArrayDeque<>();
    private boolean held;
    private int releases;
    private boolean handingOff;

    /**
     * Queues for the permit.
     *
     * @return a future completing with the release action once the permit is granted;
     *         running the release action more than once has no effect
     */
    synchronized CompletableFuture<Runnable> acquire() {
        CompletableFuture<Runnable> grant = new CompletableFuture<>();
        if (held) {
            waiters.add(grant);
        } else {
            held = true;
            grant.complete(newRelease());
        }
        return grant;
    }

    private Runnable newRelease() {
        AtomicBoolean released = new AtomicBoolean();
        return () -> {
            if (released.compareAndSet(false, true)) {
                release();
            }
        };
    }

    private void release() {
        synchronized (this) {
            releases++;
            if (handingOff) {
                return;
            }
            handingOff = true;
        }
        while (true) {
            CompletableFuture<Runnable> next;
            synchronized (this) {
                if (releases == 0) {
                    handingOff = false;
                    return;
                }
                releases--;
                next = waiters.poll();
                if (next == null) {
                    held = false;
                    continue;
                }
            }
            next.complete(newRelease());
        }
    }
}
