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

package org.slquery.config;

import org.slquery.protocol.ClientFlags;

import java.io.File;
import java.time.Duration;
import java.util.Optional;

/**
 * Everything needed to open and authenticate a connection. Fixed for the lifetime of a client
 * and reused verbatim on every reconnect.
 *
 * @param host the server host
 * @param port the query port
 * @param password the query password
 * @param permissions the requested permission bitset, {@code -1L} for all
 * @param kickPower the requested kick power, 0 to 255
 * @param username the username for server side logging
 * @param flags the handshake flags, including the derived ones
 * @param connectionTimeout the TCP connect timeout
 * @param handshakeTimeout the time allowed for the whole handshake
 * @param maxFrameSize the largest inbound frame payload accepted
 * @param enableTls whether to wrap the connection in TLS
 * @param tlsCertificate the trusted certificate (PEM) for TLS
 */
public record ConnectionSettings(
        String host,
        int port,
        String password,
        long permissions,
        int kickPower,
        Optional<String> username,
        ClientFlags flags,
        Duration connectionTimeout,
        Duration handshakeTimeout,
        int maxFrameSize,
        boolean enableTls,
        Optional<File> tlsCertificate) {

    @Override
    public String toString() {
        return "ConnectionSettings{host=" + host + ", port=" + port + ", permissions=" + Long.toUnsignedString(permissions)
                + ", kickPower=" + kickPower + ", username=" + username + ", flags=" + flags + ", tls=" + enableTls
                + "}";
    }
}
