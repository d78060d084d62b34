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

import org.slquery.client.CommandResponse;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * The slot of the one command awaiting a response. Resolves exactly once.
 */
final class PendingCommand {

    private final String command;
    private final CompletableFuture<CommandResponse> future = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timeoutTask;

    PendingCommand(String command) {
        this.command = command;
        future.whenComplete((response, error) -> cancelTimeout());
    }

    String command() {
        return command;
    }

    CompletableFuture<CommandResponse> future() {
        return future;
    }

    void armTimeout(ScheduledFuture<?> task) {
        timeoutTask = task;
        if (future.isDone()) {
            task.cancel(false);
        }
    }

    boolean complete(CommandResponse response) {
        return future.complete(response);
    }

    boolean fail(Throwable error) {
        return future.completeExceptionally(error);
    }

    boolean cancel() {
        return future.cancel(false);
    }

    private void cancelTimeout() {
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
