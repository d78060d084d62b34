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

package org.slquery;

import org.slquery.client.tcp.QueryTcpClient;
import org.slquery.client.tcp.QueryTcpClientBuilder;

/**
 * Main entry point for creating query clients.
 *
 * <pre>{@code
 * var client = SlQuery.tcpClientBuilder()
 *     .host("localhost")
 *     .port(7777)
 *     .password("secret")
 *     .buildAndConnect()
 *     .join();
 *
 * System.out.println(client.sendCommand("/players").join());
 * }</pre>
 *
 * <h2>Version Information</h2>
 * <pre>{@code
 * String version = SlQuery.version();           // e.g., "0.1.0"
 * SlQueryVersion info = SlQuery.versionInfo();  // Full version details
 * }</pre>
 *
 * @see QueryTcpClientBuilder
 * @see SlQueryVersion
 */
public final class SlQuery {

    private SlQuery() {}

    /**
     * Creates a builder for TCP query clients.
     *
     * @return a TCP client builder
     */
    public static QueryTcpClientBuilder tcpClientBuilder() {
        return QueryTcpClient.builder();
    }

    /**
     * Returns the SDK version string.
     *
     * @return the version string (e.g., "0.1.0")
     */
    public static String version() {
        return SlQueryVersion.getInstance().getVersion();
    }

    /**
     * Returns detailed version information.
     *
     * @return the version information object
     */
    public static SlQueryVersion versionInfo() {
        return SlQueryVersion.getInstance();
    }
}
