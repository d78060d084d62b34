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

package org.slquery.examples.remoteadmin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slquery.SlQuery;
import org.slquery.client.CommandResponse;
import org.slquery.client.tcp.QueryTcpClient;
import org.slquery.exception.QueryCommandExecutionException;
import org.slquery.exception.QueryException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * RemoteAdminCommand demonstrates how to execute remote admin commands and read their
 * responses.
 *
 * <p>Usage: {@code RemoteAdminCommand <password> [command...]}. Commands must start with
 * {@code /}; without any, {@code /players} is executed.
 */
public final class RemoteAdminCommand {
    private static final Logger log = LoggerFactory.getLogger(RemoteAdminCommand.class);

    private static final String HOST = "localhost";
    private static final int PORT = 7777;
    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);

    private RemoteAdminCommand() {
        // Utility class
    }

    public static void main(String[] args) {
        if (args.length < 1) {
            log.error("Usage: RemoteAdminCommand <password> [command...]");
            System.exit(2);
        }
        List<String> commands = args.length > 1 ? List.of(args).subList(1, args.length) : List.of("/players");
        QueryTcpClient client = null;

        try {
            log.info("=== Remote Admin Command Example ({}) ===", SlQuery.versionInfo());

            log.info("Connecting to {}:{}...", HOST, PORT);
            client = SlQuery.tcpClientBuilder()
                    .host(HOST)
                    .port(PORT)
                    .password(args[0])
                    .username("slquery-example")
                    .commandTimeout(COMMAND_TIMEOUT)
                    .buildAndConnect()
                    .join();
            log.info("Connected successfully");

            for (String command : commands) {
                execute(client, command);
            }
        } catch (CompletionException | QueryException e) {
            log.error("Example failed", e);
            System.exit(1);
        } finally {
            if (client != null) {
                client.close().join();
                log.info("Client closed");
            }
        }
    }

    private static void execute(QueryTcpClient client, String command) {
        try {
            CommandResponse response = client.sendCommand(command).join();
            if (response.success()) {
                log.info("{} -> {}", command, response.content());
            } else {
                log.warn("{} -> {}", command, response);
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof QueryCommandExecutionException) {
                QueryCommandExecutionException error = (QueryCommandExecutionException) e.getCause();
                log.error("{} raised an exception on the server: {}", command, error.getServerMessage());
            } else {
                throw e;
            }
        }
    }
}
