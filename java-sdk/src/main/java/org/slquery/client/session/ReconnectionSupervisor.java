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
import org.slquery.client.ClientState;
import org.slquery.config.RetryPolicy;
import org.slquery.exception.QueryAuthenticationException;
import org.slquery.exception.QueryClientClosedException;
import org.slquery.exception.QueryHandshakeException;
import org.slquery.exception.QueryReconnectionExhaustedException;
import org.slquery.protocol.DecodedMessage;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps a session alive.
 *
 * <p>Opens the first connection on {@link #start()}. Whenever the connection ends for any reason
 * other than the client closing it, or a connection attempt fails, the supervisor closes what is
 * left of the old connection and opens a new one with the same settings. Consecutive failures
 * are counted; the count resets once a handshake succeeds. When the count exceeds
 * {@link RetryPolicy#getMaxRetries()} the session terminates with a
 * {@link QueryReconnectionExhaustedException}.
 *
 * <p>Every connection is tagged with a generation. Events from a connection whose generation is
 * no longer current are ignored.
 */
public final class ReconnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ReconnectionSupervisor.class);

    private final QueryConnector connector;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final SessionCallbacks callbacks;

    private final Object lock = new Object();
    private volatile long generation;
    private volatile ClientState state = ClientState.DISCONNECTED;
    private int attempts;
    private boolean started;
    private QueryConnection current;
    private CompletableFuture<QueryConnection> ready = new CompletableFuture<>();

    public ReconnectionSupervisor(
            QueryConnector connector,
            RetryPolicy retryPolicy,
            ScheduledExecutorService scheduler,
            SessionCallbacks callbacks) {
        this.connector = connector;
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
        this.callbacks = callbacks;
    }

    /**
     * Opens the first connection. Calls after the first have no effect.
     */
    public void start() {
        synchronized (lock) {
            if (started) {
                return;
            }
            started = true;
        }
        connect();
    }

    private void connect() {
        long attemptGeneration;
        synchronized (lock) {
            if (state == ClientState.CLOSED) {
                return;
            }
            attemptGeneration = ++generation;
            state = ClientState.HANDSHAKING;
        }

        CompletableFuture<QueryConnection> attempt;
        try {
            attempt = connector.connect(new GenerationListener(attemptGeneration));
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        attempt.whenComplete((connection, error) -> {
            if (error != null) {
                Throwable cause = CommandCorrelator.unwrap(error);
                log.warn("Connection attempt failed: {}", cause.getMessage());
                handleDisconnect(attemptGeneration, reasonFor(cause), cause, false);
            } else {
                onConnected(attemptGeneration, connection);
            }
        });
    }

    private void onConnected(long connectionGeneration, QueryConnection connection) {
        CompletableFuture<QueryConnection> waiting = null;
        synchronized (lock) {
            if (connectionGeneration == generation && state != ClientState.CLOSED) {
                current = connection;
                attempts = 0;
                state = ClientState.READY;
                waiting = ready;
            }
        }
        if (waiting == null) {
            log.debug("Closing superseded connection to {}", connection.remoteAddress());
            connection.close();
            return;
        }
        log.info("Session ready on {}", connection.remoteAddress());
        callbacks.onReady(connection);
        waiting.complete(connection);
    }

    private void handleDisconnect(long eventGeneration, DisconnectReason reason, Throwable cause, boolean established) {
        QueryConnection old;
        Throwable terminalCause = null;
        int attempt = 0;
        synchronized (lock) {
            if (eventGeneration != generation || state == ClientState.CLOSED) {
                return;
            }
            generation++;
            old = current;
            current = null;
            state = ClientState.DISCONNECTED;
            if (ready.isDone()) {
                ready = new CompletableFuture<>();
            }
            if (reason == DisconnectReason.CLIENT_INITIATED) {
                terminalCause = new QueryClientClosedException();
            } else {
                attempt = attempts++;
                if (attempt > retryPolicy.getMaxRetries()) {
                    terminalCause = new QueryReconnectionExhaustedException(attempt, cause);
                }
            }
        }

        if (old != null) {
            old.close();
        }
        if (established) {
            log.warn("Connection lost: {}", reason);
            callbacks.onConnectionLost(reason, cause);
        }
        if (terminalCause != null) {
            terminate(terminalCause, true);
            return;
        }

        Duration delay = retryPolicy.delayFor(attempt);
        log.info("Reconnecting (attempt {} of {}) in {} ms", attempt + 1, retryPolicy.getMaxRetries() + 1,
                delay.toMillis());
        try {
            if (delay.isZero()) {
                scheduler.execute(this::connect);
            } else {
                scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (RejectedExecutionException e) {
            terminate(new QueryClientClosedException("Client is closed", e), true);
        }
    }

    private void terminate(Throwable cause, boolean notify) {
        CompletableFuture<QueryConnection> waiting;
        QueryConnection old;
        synchronized (lock) {
            if (state == ClientState.CLOSED) {
                return;
            }
            state = ClientState.CLOSED;
            generation++;
            if (ready.isDone()) {
                ready = new CompletableFuture<>();
            }
            waiting = ready;
            old = current;
            current = null;
        }
        if (old != null) {
            old.close();
        }
        waiting.completeExceptionally(cause);
        if (notify) {
            log.error("Session terminated", cause);
            callbacks.onTerminated(cause);
        }
    }

    /**
     * Stops supervising and closes the current connection. No reconnect follows.
     */
    public void stop() {
        terminate(new QueryClientClosedException(), false);
    }

    /**
     * Returns a future completing with the current connection once it is ready. Fails once the
     * supervisor terminates.
     *
     * @return the readiness future
     */
    public CompletableFuture<QueryConnection> ready() {
        synchronized (lock) {
            return ready;
        }
    }

    public ClientState state() {
        return state;
    }

    public Optional<QueryConnection> currentConnection() {
        synchronized (lock) {
            return Optional.ofNullable(current);
        }
    }

    /**
     * Returns the number of consecutive failed connection attempts.
     *
     * @return the attempt counter
     */
    public int attempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    static DisconnectReason reasonFor(Throwable cause) {
        if (cause instanceof QueryAuthenticationException || cause instanceof QueryHandshakeException) {
            return DisconnectReason.PROTOCOL_ERROR;
        }
        return DisconnectReason.NETWORK_ERROR;
    }

    private final class GenerationListener implements ConnectionListener {

        private final long listenerGeneration;

        GenerationListener(long listenerGeneration) {
            this.listenerGeneration = listenerGeneration;
        }

        @Override
        public void onMessage(DecodedMessage message) {
            if (listenerGeneration == generation) {
                callbacks.onMessage(message);
            }
        }

        @Override
        public void onDisconnected(DisconnectReason reason, Throwable cause) {
            handleDisconnect(listenerGeneration, reason, cause, true);
        }
    }
}
