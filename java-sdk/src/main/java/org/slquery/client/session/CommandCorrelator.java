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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slquery.client.CommandResponse;
import org.slquery.exception.QueryClientClosedException;
import org.slquery.exception.QueryCommandExecutionException;
import org.slquery.exception.QueryTimeoutException;
import org.slquery.protocol.DecodedMessage;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Pairs commands with their responses.
 *
 * <p>Responses carry no request identifier, so at most one command may await a response at any
 * time. Commands queue for an exclusive send permit in submission order; the holder installs the
 * pending slot, arms its timeout and transmits once a connection is available. The permit is
 * released whenever the slot resolves, whatever the outcome, before the caller observes the result.
 *
 * <p>A command whose slot resolves while it is still waiting for a connection is never written.
 */
public final class CommandCorrelator {

    private static final Logger log = LoggerFactory.getLogger(CommandCorrelator.class);

    private final ScheduledExecutorService timer;
    private final SendPermit permit = new SendPermit();
    private final AtomicReference<PendingCommand> pending = new AtomicReference<>();
    private volatile Throwable closedCause;

    public CommandCorrelator(ScheduledExecutorService timer) {
        this.timer = timer;
    }

    /**
     * Queues a command.
     *
     * @param command the command text, used for logging
     * @param timeout how long to wait for the response once the permit is held, including the
     *                wait for a connection
     * @param connection supplies the connection to write to; asked once the slot is installed
     * @param transmit writes the command; invoked only while the slot is still pending
     * @return the response future
     */
    public CompletableFuture<CommandResponse> submit(
            String command,
            Duration timeout,
            Supplier<CompletableFuture<QueryConnection>> connection,
            Function<QueryConnection, CompletableFuture<Void>> transmit) {
        CompletableFuture<CommandResponse> result = new CompletableFuture<>();
        permit.acquire().thenAccept(release -> execute(command, timeout, connection, transmit, release, result));
        return result;
    }

    private void execute(
            String command,
            Duration timeout,
            Supplier<CompletableFuture<QueryConnection>> connection,
            Function<QueryConnection, CompletableFuture<Void>> transmit,
            Runnable release,
            CompletableFuture<CommandResponse> result) {
        Throwable closed = closedCause;
        if (closed != null) {
            release.run();
            result.completeExceptionally(closed);
            return;
        }

        PendingCommand slot = new PendingCommand(command);
        slot.future().whenComplete((response, error) -> {
            pending.compareAndSet(slot, null);
            release.run();
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(response);
            }
        });

        PendingCommand stale = pending.getAndSet(slot);
        if (stale != null) {
            log.debug("Cancelling stale pending command '{}'", stale.command());
            stale.cancel();
        }

        try {
            slot.armTimeout(timer.schedule(() -> expire(slot, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            fail(slot, new QueryClientClosedException("Client is closed", e));
            return;
        }

        // close() may have run between the first check and installing the slot
        closed = closedCause;
        if (closed != null) {
            fail(slot, closed);
            return;
        }

        CompletableFuture<Void> sent;
        try {
            sent = connection.get().thenCompose(target -> transmitIfPending(slot, target, transmit));
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Void> write = sent;
        // detaches the wait for a connection once the slot is gone
        slot.future().whenComplete((response, error) -> write.cancel(false));
        write.whenComplete((ignored, error) -> {
            if (error != null) {
                fail(slot, unwrap(error));
            }
        });
    }

    private CompletableFuture<Void> transmitIfPending(
            PendingCommand slot, QueryConnection target, Function<QueryConnection, CompletableFuture<Void>> transmit) {
        synchronized (slot) {
            if (pending.get() != slot) {
                log.debug("Not sending command '{}', it is no longer pending", slot.command());
                return CompletableFuture.completedFuture(null);
            }
            log.debug("Sending command '{}'", slot.command());
            return transmit.apply(target);
        }
    }

    private void expire(PendingCommand slot, Duration timeout) {
        // pairs with transmitIfPending: an expired command is never written afterwards
        synchronized (slot) {
            if (!pending.compareAndSet(slot, null)) {
                return;
            }
        }
        log.debug("Command '{}' timed out after {} ms", slot.command(), timeout.toMillis());
        slot.fail(new QueryTimeoutException(timeout));
    }

    private void fail(PendingCommand slot, Throwable error) {
        if (pending.compareAndSet(slot, null)) {
            slot.fail(error);
        }
    }

    /**
     * Resolves the pending command with a command result message.
     *
     * @param message a message for which {@link DecodedMessage#isCommandResult()} holds
     * @return whether a pending command was resolved; false if the message was dropped
     */
    public boolean resolve(DecodedMessage message) {
        if (!message.isCommandResult()) {
            throw new IllegalArgumentException("Not a command result: " + message.kind());
        }
        PendingCommand slot = pending.getAndSet(null);
        if (slot == null) {
            log.debug("Dropping {} message, no command is pending", message.contentType());
            return false;
        }
        switch (message.kind()) {
            case REMOTE_ADMIN_SUCCESS:
                return slot.complete(new CommandResponse(message.content(), true));
            case REMOTE_ADMIN_FAILURE:
                return slot.complete(new CommandResponse(message.content(), false));
            default:
                return slot.fail(new QueryCommandExecutionException(message.content()));
        }
    }

    /**
     * Fails the pending command, if any. Queued commands are unaffected.
     *
     * @param error the failure
     */
    public void failPending(Throwable error) {
        PendingCommand slot = pending.getAndSet(null);
        if (slot != null) {
            slot.fail(error);
        }
    }

    /**
     * Fails the pending command and every command that reaches the permit afterwards.
     *
     * @param cause the failure
     */
    public void close(Throwable cause) {
        closedCause = cause;
        failPending(cause);
    }

    public boolean hasPending() {
        return pending.get() != null;
    }

    /**
     * Strips the {@link CompletionException} wrappers added by dependent futures.
     *
     * @param error a failure observed on a future
     * @return the underlying cause
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
