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

package org.slquery.examples.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slquery.SlQuery;
import org.slquery.client.QueryClient;

/**
 * ConsoleTail demonstrates subscribing to the server console and logs.
 *
 * <p>Usage: {@code ConsoleTail <password>}. Prints console lines until the process is
 * interrupted or the client gives up reconnecting.
 */
public final class ConsoleTail {
    private static final Logger log = LoggerFactory.getLogger(ConsoleTail.class);

    private static final String HOST = "localhost";
    private static final int PORT = 7777;
    private static final long POLL_INTERVAL_MILLIS = 500;

    private ConsoleTail() {
        // Utility class
    }

    public static void main(String[] args) throws InterruptedException {
        if (args.length < 1) {
            log.error("Usage: ConsoleTail <password>");
            System.exit(2);
        }

        QueryClient client = SlQuery.tcpClientBuilder()
                .host(HOST)
                .port(PORT)
                .password(args[0])
                .subscribeConsole(true)
                .subscribeLogs(true)
                .suppressCommandResponses(true)
                .build();

        client.addConsoleListener(line -> log.info("[console] {}", line));
        client.ready().whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Could not connect", error);
            } else {
                log.info("Tailing console of {}:{}, press Ctrl+C to stop", HOST, PORT);
            }
        });
        Runtime.getRuntime().addShutdownHook(new Thread(() -> client.close().join()));

        // the client closes itself once it runs out of reconnection attempts
        while (!client.isClosed()) {
            Thread.sleep(POLL_INTERVAL_MILLIS);
        }
    }
}
