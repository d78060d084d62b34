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

import io.netty.buffer.ByteBuf;

import java.util.concurrent.CompletableFuture;

/**
 * An authenticated connection to a query server.
 */
public interface QueryConnection {

    /**
     * Sends one frame. Takes ownership of the payload buffer.
     *
     * @param payload the frame payload
     * @return a future completing once the frame is written
     */
    CompletableFuture<Void> send(ByteBuf payload);

    boolean isActive();

    String remoteAddress();

    /**
     * Closes the connection. Idempotent; the closure is reported as
     * {@link DisconnectReason#CLIENT_INITIATED}.
     *
     * @return a future completing once the connection is closed
     */
    CompletableFuture<Void> close();
}
