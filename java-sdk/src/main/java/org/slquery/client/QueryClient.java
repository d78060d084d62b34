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

package org.slquery.client;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Client of a game server's query protocol.
 *
 * <p>The client connects when it is built and keeps the connection alive, reconnecting after
 * unexpected disconnects. Commands are executed one at a time: the protocol carries no request
 * identifiers, so a response always belongs to the single command awaiting one.
 *
 * <pre>{@code
 * var client = QueryTcpClient.builder()
 *     .host("127.0.0.1")
 *     .port(7777)
 *     .password("secret")
 *     .subscribeConsole(true)
 *     .build();
 *
 * client.addConsoleListener(line -> System.out.println(line));
 * CommandResponse response = client.sendCommand("/players").join();
 *
 * client.close().join();
 * }</pre>
 */
public interface QueryClient {

    /** Prefix of commands executed through remote admin. */
    String REMOTE_ADMIN_PREFIX = "/";

    Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Sends a command using the client's default timeout.
     *
     * @param command the command, prefixed with {@code /} unless responses are suppressed
     * @return the response, or {@link CommandResponse#EMPTY} when responses are suppressed
     * @see #sendCommand(String, Duration)
     */
    CompletableFuture<CommandResponse> sendCommand(String command);

    /**
     * Sends a command and waits for its response.
     *
     * <p>Argument problems are thrown directly, before anything is sent. The returned future
     * fails with {@link org.slquery.exception.QueryTimeoutException} when no response arrives in
     * time, {@link org.slquery.exception.QueryCommandExecutionException} when the command raised
     * an exception on the server, and {@link org.slquery.exception.QueryConnectionLostException}
     * when the connection dropped while waiting.
     *
     * @param command the command, prefixed with {@code /} unless responses are suppressed
     * @param timeout the maximum time to wait for the response
     * @return the response, or {@link CommandResponse#EMPTY} when responses are suppressed
     * @throws org.slquery.exception.QueryValidationException if the command is null or blank
     * @throws org.slquery.exception.QueryProtocolUsageException if the command lacks the prefix
     *         while responses are awaited
     * @throws org.slquery.exception.QueryClientClosedException if the client is closed
     */
    CompletableFuture<CommandResponse> sendCommand(String command, Duration timeout);

    /**
     * Sends raw content without waiting for any acknowledgement. Content sent while the session
     * is not ready is written once it is.
     *
     * @param content the content to send
     */
    void sendRaw(String content);

    /**
     * Registers a listener for console and log lines. Only receives messages if the client
     * subscribed to them when it was built.
     *
     * @param listener the listener
     */
    void addConsoleListener(ConsoleMessageListener listener);

    /**
     * Returns a future completing once a session is ready, immediately if one already is.
     * Fails if the client closes first.
     *
     * @return the readiness future
     */
    CompletableFuture<Void> ready();

    ClientState state();

    boolean isClosed();

    /**
     * Closes the client, cancelling any command in flight. Safe to call more than once.
     *
     * @return a future completing once resources are released
     */
    CompletableFuture<Void> close();
}
