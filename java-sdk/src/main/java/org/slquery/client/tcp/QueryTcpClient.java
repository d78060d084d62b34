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

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.Future;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slquery.client.ClientState;
import org.slquery.client.CommandResponse;
import org.slquery.client.ConsoleMessageListener;
import org.slquery.client.QueryClient;
import org.slquery.client.session.CommandCorrelator;
import org.slquery.client.session.DisconnectReason;
import org.slquery.client.session.QueryConnection;
import org.slquery.client.session.QueryConnector;
import org.slquery.client.session.ReconnectionSupervisor;
import org.slquery.client.session.SessionCallbacks;
import org.slquery.config.ConnectionSettings;
import org.slquery.config.RetryPolicy;
import org.slquery.exception.QueryClientClosedException;
import org.slquery.exception.QueryConnectionLostException;
import org.slquery.exception.QueryInvalidArgumentException;
import org.slquery.exception.QueryProtocolUsageException;
import org.slquery.exception.QueryValidationException;
import org.slquery.protocol.ClientFlag;
import org.slquery.protocol.ContentTypeToServer;
import org.slquery.protocol.DecodedMessage;
import org.slquery.serde.MessageCodec;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Query client over TCP using Netty.
 *
 * <p>One event loop group serves every connection the client opens over its lifetime, and its
 * command timers. The client starts connecting as soon as it is built.
 *
 * @see QueryTcpClientBuilder
 */
public final class QueryTcpClient implements QueryClient {
    private static final Logger log = LoggerFactory.getLogger(QueryTcpClient.class);

    private final ConnectionSettings settings;
    private final Duration commandTimeout;
    private final boolean suppressResponses;
    private final EventLoopGroup eventLoopGroup;
    private final CommandCorrelator correlator;
    private final ReconnectionSupervisor supervisor;
    private final List<ConsoleMessageListener> consoleListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    // tail of the fire-and-forget frames, written in call order
    private CompletableFuture<Void> outbound = CompletableFuture.completedFuture(null);

    QueryTcpClient(ConnectionSettings settings, Duration commandTimeout, RetryPolicy retryPolicy) {
        this.settings = settings;
        this.commandTimeout = commandTimeout;
        this.suppressResponses = settings.flags().contains(ClientFlag.SUPPRESS_COMMAND_RESPONSES);
        this.eventLoopGroup = new NioEventLoopGroup();
        QueryConnector connector = new QueryTcpConnector(settings, eventLoopGroup);
        this.correlator = new CommandCorrelator(eventLoopGroup);
        this.supervisor = new ReconnectionSupervisor(connector, retryPolicy, eventLoopGroup, new Callbacks());
    }

    /**
     * Creates a new builder for configuring QueryTcpClient.
     *
     * @return a new builder instance
     */
    public static QueryTcpClientBuilder builder() {
        return new QueryTcpClientBuilder();
    }

    void start() {
        log.info("Connecting to {}:{}", settings.host(), settings.port());
        supervisor.start();
    }

    @Override
    public CompletableFuture<CommandResponse> sendCommand(String command) {
        return sendCommand(command, commandTimeout);
    }

    @Override
    public CompletableFuture<CommandResponse> sendCommand(String command, Duration timeout) {
        if (StringUtils.isBlank(command)) {
            throw new QueryValidationException("Command cannot be null or blank");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new QueryInvalidArgumentException("Timeout must be positive");
        }
        if (closed.get()) {
            throw new QueryClientClosedException();
        }
        if (suppressResponses) {
            send(command, ContentTypeToServer.COMMAND);
            return CompletableFuture.completedFuture(CommandResponse.EMPTY);
        }
        if (!command.startsWith(REMOTE_ADMIN_PREFIX)) {
            throw new QueryProtocolUsageException("Only remote admin commands starting with '" + REMOTE_ADMIN_PREFIX
                    + "' receive a response; enable suppressCommandResponses to send other commands");
        }
        return correlator.submit(command, timeout, supervisor::ready, connection ->
                connection.send(MessageCodec.encode(command, ContentTypeToServer.COMMAND)));
    }

    @Override
    public void sendRaw(String content) {
        Objects.requireNonNull(content, "content");
        if (closed.get()) {
            throw new QueryClientClosedException();
        }
        send(content, ContentTypeToServer.RAW_CONTENT);
    }

    private synchronized void send(String content, ContentTypeToServer contentType) {
        outbound = outbound.<Void>handle((ignored, error) -> null)
                .thenCompose(ignored -> supervisor.ready())
                .thenCompose(connection -> connection.send(MessageCodec.encode(content, contentType)));
        outbound.whenComplete((ignored, error) -> {
            if (error == null) {
                return;
            }
            Throwable cause = CommandCorrelator.unwrap(error);
            if (closed.get()) {
                log.debug("Dropped {} frame on close: {}", contentType, cause.getMessage());
            } else {
                log.warn("Failed to send {} frame: {}", contentType, cause.getMessage());
            }
        });
    }

    @Override
    public void addConsoleListener(ConsoleMessageListener listener) {
        consoleListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public CompletableFuture<Void> ready() {
        return supervisor.ready().thenApply(connection -> null);
    }

    @Override
    public ClientState state() {
        return closed.get() ? ClientState.CLOSED : supervisor.state();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public CompletableFuture<Void> close() {
        if (!closed.compareAndSet(false, true)) {
            return closeFuture;
        }
        log.info("Closing client for {}:{}", settings.host(), settings.port());
        QueryClientClosedException cause = new QueryClientClosedException();
        correlator.close(cause);
        supervisor.stop();
        Future<?> shutdown = eventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        shutdown.addListener(future -> {
            if (future.isSuccess()) {
                closeFuture.complete(null);
            } else {
                closeFuture.completeExceptionally(future.cause());
            }
        });
        return closeFuture;
    }

    private void deliverConsoleLine(String line) {
        for (ConsoleMessageListener listener : consoleListeners) {
            try {
                listener.onConsoleMessage(line);
            } catch (RuntimeException e) {
                log.warn("Console listener failed", e);
            }
        }
    }

    private final class Callbacks implements SessionCallbacks {

        @Override
        public void onReady(QueryConnection connection) {
            log.info("Connected to {} with flags {}", connection.remoteAddress(), settings.flags());
        }

        @Override
        public void onMessage(DecodedMessage message) {
            switch (message.kind()) {
                case CONSOLE_LINE:
                    deliverConsoleLine(message.content());
                    break;
                case REMOTE_ADMIN_SUCCESS:
                case REMOTE_ADMIN_FAILURE:
                case COMMAND_EXCEPTION:
                    correlator.resolve(message);
                    break;
                default:
                    log.debug("Ignoring message with unrecognized content type {}", message.rawContentType());
            }
        }

        @Override
        public void onConnectionLost(DisconnectReason reason, Throwable cause) {
            correlator.failPending(new QueryConnectionLostException("Connection lost: " + reason, cause));
        }

        @Override
        public void onTerminated(Throwable cause) {
            correlator.close(cause);
            close();
        }
    }
}
