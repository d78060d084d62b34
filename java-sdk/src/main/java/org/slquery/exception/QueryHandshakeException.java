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

package org.slquery.exception;

/**
 * Exception thrown when the handshake fails for a reason other than a wrong password: a
 * malformed or unexpected server reply, an unsupported protocol version, a rejection or a
 * handshake that did not complete in time.
 */
public class QueryHandshakeException extends QueryServerException {

    /**
     * Constructs a new QueryHandshakeException.
     *
     * @param reason the description of the failure
     */
    public QueryHandshakeException(String reason) {
        super("Handshake failed", reason);
    }
}
