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

import org.slquery.protocol.DecodedMessage;

/**
 * Session events published by the {@link ReconnectionSupervisor}. Events of superseded
 * connections are never published.
 */
public interface SessionCallbacks {

    void onReady(QueryConnection connection);

    void onMessage(DecodedMessage message);

    /**
     * Called when an established connection ends unexpectedly, before any reconnect.
     *
     * @param reason why the connection ended
     * @param cause the error that ended it, or {@code null}
     */
    void onConnectionLost(DisconnectReason reason, Throwable cause);

    /**
     * Called once when the supervisor gives up. Not called after {@link ReconnectionSupervisor#stop()}.
     *
     * @param cause why the session ended
     */
    void onTerminated(Throwable cause);
}
