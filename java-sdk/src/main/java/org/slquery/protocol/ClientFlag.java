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

package org.slquery.protocol;

/**
 * Capability flags negotiated during the handshake.
 */
public enum ClientFlag {
    /** The server does not send responses to commands; non remote admin commands are allowed. */
    SUPPRESS_COMMAND_RESPONSES(0x01),
    /** The server pushes console output to the client. */
    SUBSCRIBE_SERVER_CONSOLE(0x02),
    /** The server pushes its log lines to the client. */
    SUBSCRIBE_SERVER_LOGS(0x04),
    /** Reserved, never requested by this client. */
    REMOTE_ADMIN_METADATA(0x08),
    /** Permissions and kick power in the handshake narrow the query user's rights. */
    RESTRICT_PERMISSIONS(0x10),
    /** The handshake carries a username the server uses in its logs. */
    SPECIFY_LOG_USERNAME(0x20);

    private final int mask;

    ClientFlag(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }
}
