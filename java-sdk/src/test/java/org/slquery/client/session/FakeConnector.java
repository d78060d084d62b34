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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Connector whose outcome is scripted per attempt. Attempts are numbered from 1.
 */
final class FakeConnector implements QueryConnector {

    private final AtomicInteger attempts = new AtomicInteger();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    private volatile IntFunction<CompletableFuture<QueryConnection>> script = attempt -> succeed(attempt);

    @Override
    public CompletableFuture<QueryConnection> connect(ConnectionListener listener) {
        int attempt = attempts.incrementAndGet();
        listeners.add(listener);
        return script.apply(attempt);
    }

    void script(IntFunction<CompletableFuture<QueryConnection>> script) {
        this.script = script;
    }

    CompletableFuture<QueryConnection> succeed(int attempt) {
        FakeConnection connection = new FakeConnection("connection-" + attempt);
        connections.add(connection);
        return CompletableFuture.completedFuture(connection);
    }

    int attempts() {
        return attempts.get();
    }

    ConnectionListener listener(int attempt) {
        return listeners.get(attempt - 1);
    }

    ConnectionListener lastListener() {
        return listeners.get(listeners.size() - 1);
    }

    List<FakeConnection> connections() {
        return connections;
    }
}
