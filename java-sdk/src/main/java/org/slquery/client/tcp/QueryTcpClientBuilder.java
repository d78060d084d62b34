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

import org.apache.commons.lang3.StringUtils;
import org.slquery.client.QueryClient;
import org.slquery.config.ConnectionSettings;
import org.slquery.config.RetryPolicy;
import org.slquery.exception.QueryInvalidArgumentException;
import org.slquery.protocol.ClientFlag;
import org.slquery.protocol.ClientFlags;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Builder for creating configured QueryTcpClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Connects in the background, commands wait for the handshake
 * var client = QueryTcpClient.builder()
 *     .host("localhost")
 *     .port(7777)
 *     .password("secret")
 *     .build();
 *
 * // Waits until the session is ready
 * var client = QueryTcpClient.builder()
 *     .host("game.example.com")
 *     .password("secret")
 *     .subscribeConsole(true)
 *     .username("moderator")
 *     .buildAndConnect()
 *     .join();
 * }</pre>
 *
 * @see QueryTcpClient#builder()
 */
public final class QueryTcpClientBuilder {
    public static final int DEFAULT_PORT = 7777;
    public static final long ALL_PERMISSIONS = -1L;
    public static final int MAX_KICK_POWER = 255;
    public static final int DEFAULT_MAX_FRAME_SIZE = 65_535;

    private String host = "localhost";
    private int port = DEFAULT_PORT;
    private String password;
    private long permissions = ALL_PERMISSIONS;
    private int kickPower = MAX_KICK_POWER;
    private String username;
    private boolean suppressCommandResponses;
    private boolean subscribeConsole;
    private boolean subscribeLogs;
    private Duration commandTimeout = QueryClient.DEFAULT_COMMAND_TIMEOUT;
    private Duration connectionTimeout = Duration.ofSeconds(5);
    private Duration handshakeTimeout = Duration.ofSeconds(5);
    private int maxFrameSize = DEFAULT_MAX_FRAME_SIZE;
    private RetryPolicy retryPolicy = RetryPolicy.immediate();
    private boolean enableTls = false;
    private File tlsCertificate;

    QueryTcpClientBuilder() {}

    /**
     * Sets the host address of the game server.
     *
     * @param host the host address
     * @return this builder
     */
    public QueryTcpClientBuilder host(String host) {
        this.host = host;
        return this;
    }

    /**
     * Sets the query port of the game server.
     *
     * @param port the port number
     * @return this builder
     */
    public QueryTcpClientBuilder port(int port) {
        this.port = port;
        return this;
    }

    /**
     * Sets the query password. Required.
     *
     * @param password the password
     * @return this builder
     */
    public QueryTcpClientBuilder password(String password) {
        this.password = password;
        return this;
    }

    /**
     * Restricts the permissions of the query user to the given bitset. By default the client
     * requests all permissions.
     *
     * @param permissions the permission bitset
     * @return this builder
     */
    public QueryTcpClientBuilder permissions(long permissions) {
        this.permissions = permissions;
        return this;
    }

    /**
     * Restricts the kick power of the query user, 0 to 255.
     *
     * @param kickPower the kick power
     * @return this builder
     */
    public QueryTcpClientBuilder kickPower(int kickPower) {
        this.kickPower = kickPower;
        return this;
    }

    /**
     * Sets the name the server uses for this client in its logs.
     *
     * @param username the username, blank for none
     * @return this builder
     */
    public QueryTcpClientBuilder username(String username) {
        this.username = username;
        return this;
    }

    /**
     * Asks the server not to answer commands. Commands then complete immediately with
     * {@link org.slquery.client.CommandResponse#EMPTY} and need not start with {@code /}.
     *
     * @param suppressCommandResponses whether to suppress responses
     * @return this builder
     */
    public QueryTcpClientBuilder suppressCommandResponses(boolean suppressCommandResponses) {
        this.suppressCommandResponses = suppressCommandResponses;
        return this;
    }

    public QueryTcpClientBuilder subscribeConsole(boolean subscribeConsole) {
        this.subscribeConsole = subscribeConsole;
        return this;
    }

    public QueryTcpClientBuilder subscribeLogs(boolean subscribeLogs) {
        this.subscribeLogs = subscribeLogs;
        return this;
    }

    /**
     * Sets the default time to wait for a command response.
     *
     * @param commandTimeout the command timeout
     * @return this builder
     */
    public QueryTcpClientBuilder commandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
        return this;
    }

    /**
     * Sets the connection timeout.
     *
     * @param connectionTimeout the connection timeout duration
     * @return this builder
     */
    public QueryTcpClientBuilder connectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets the time allowed for the handshake once connected.
     *
     * @param handshakeTimeout the handshake timeout duration
     * @return this builder
     */
    public QueryTcpClientBuilder handshakeTimeout(Duration handshakeTimeout) {
        this.handshakeTimeout = handshakeTimeout;
        return this;
    }

    /**
     * Sets the largest frame payload accepted from the server.
     *
     * @param maxFrameSize the limit in bytes
     * @return this builder
     */
    public QueryTcpClientBuilder maxFrameSize(int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
        return this;
    }

    /**
     * Sets the reconnection policy. Defaults to {@link RetryPolicy#immediate()}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public QueryTcpClientBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /**
     * Enables or disables TLS for the TCP connection.
     *
     * @param enableTls whether to enable TLS
     * @return this builder
     */
    public QueryTcpClientBuilder tls(boolean enableTls) {
        this.enableTls = enableTls;
        return this;
    }

    /**
     * Enables TLS for the TCP connection.
     *
     * @return this builder
     */
    public QueryTcpClientBuilder enableTls() {
        this.enableTls = true;
        return this;
    }

    /**
     * Sets a custom trusted certificate (PEM file) to validate the server certificate.
     *
     * @param tlsCertificate the PEM file containing the certificate or CA chain
     * @return this builder
     */
    public QueryTcpClientBuilder tlsCertificate(File tlsCertificate) {
        this.tlsCertificate = tlsCertificate;
        return this;
    }

    /**
     * Sets a custom trusted certificate (PEM file path) to validate the server certificate.
     *
     * @param tlsCertificatePath the PEM file path containing the certificate or CA chain
     * @return this builder
     */
    public QueryTcpClientBuilder tlsCertificate(String tlsCertificatePath) {
        this.tlsCertificate = StringUtils.isBlank(tlsCertificatePath) ? null : new File(tlsCertificatePath);
        return this;
    }

    /**
     * Builds the client and starts connecting in the background.
     *
     * @return a new QueryTcpClient instance
     * @throws QueryInvalidArgumentException if any setting is missing or out of range
     */
    public QueryTcpClient build() {
        ConnectionSettings settings = toSettings();
        QueryTcpClient client = new QueryTcpClient(settings, commandTimeout, retryPolicy);
        client.start();
        return client;
    }

    /**
     * Builds the client and waits for its first session.
     *
     * @return a CompletableFuture that completes with the client once the handshake succeeded,
     *         or fails once the client gave up
     * @throws QueryInvalidArgumentException if any setting is missing or out of range
     */
    public CompletableFuture<QueryTcpClient> buildAndConnect() {
        QueryTcpClient client = build();
        return client.ready().thenApply(v -> client);
    }

    ConnectionSettings toSettings() {
        if (StringUtils.isBlank(host)) {
            throw new QueryInvalidArgumentException("Host cannot be null or empty");
        }
        if (port < 1 || port > 65_535) {
            throw new QueryInvalidArgumentException("Port must be between 1 and 65535");
        }
        if (StringUtils.isEmpty(password)) {
            throw new QueryInvalidArgumentException("Password cannot be null or empty");
        }
        if (kickPower < 0 || kickPower > MAX_KICK_POWER) {
            throw new QueryInvalidArgumentException("Kick power must be between 0 and " + MAX_KICK_POWER);
        }
        requirePositive(commandTimeout, "Command timeout");
        requirePositive(connectionTimeout, "Connection timeout");
        requirePositive(handshakeTimeout, "Handshake timeout");
        if (maxFrameSize <= 0) {
            throw new QueryInvalidArgumentException("Max frame size must be positive");
        }
        if (retryPolicy == null) {
            throw new QueryInvalidArgumentException("Retry policy cannot be null");
        }
        if (tlsCertificate != null && !enableTls) {
            throw new QueryInvalidArgumentException("A TLS certificate requires TLS to be enabled");
        }

        Optional<String> logUsername = StringUtils.isBlank(username) ? Optional.empty() : Optional.of(username);
        if (logUsername.isPresent() && logUsername.get().getBytes(StandardCharsets.UTF_8).length > 0xFFFF) {
            throw new QueryInvalidArgumentException("Username is too long");
        }
        return new ConnectionSettings(
                host,
                port,
                password,
                permissions,
                kickPower,
                logUsername,
                deriveFlags(logUsername.isPresent()),
                connectionTimeout,
                handshakeTimeout,
                maxFrameSize,
                enableTls,
                Optional.ofNullable(tlsCertificate));
    }

    private ClientFlags deriveFlags(boolean hasUsername) {
        ClientFlags flags = ClientFlags.none();
        if (suppressCommandResponses) {
            flags = flags.with(ClientFlag.SUPPRESS_COMMAND_RESPONSES);
        }
        if (subscribeConsole) {
            flags = flags.with(ClientFlag.SUBSCRIBE_SERVER_CONSOLE);
        }
        if (subscribeLogs) {
            flags = flags.with(ClientFlag.SUBSCRIBE_SERVER_LOGS);
        }
        if (permissions != ALL_PERMISSIONS || kickPower != MAX_KICK_POWER) {
            flags = flags.with(ClientFlag.RESTRICT_PERMISSIONS);
        }
        if (hasUsername) {
            flags = flags.with(ClientFlag.SPECIFY_LOG_USERNAME);
        }
        return flags;
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new QueryInvalidArgumentException(name + " must be positive");
        }
    }
}
