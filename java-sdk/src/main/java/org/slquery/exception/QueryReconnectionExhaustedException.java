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
 * Exception signalling that the client gave up reconnecting after too many consecutive failed
 * attempts. This is terminal: the client closes itself and a new one must be created.
 */
public class QueryReconnectionExhaustedException extends QueryException {

    private final int attempts;

    /**
     * Constructs a new QueryReconnectionExhaustedException.
     *
     * @param attempts the number of consecutive failed reconnection attempts
     * @param cause the failure that ended the last attempt, may be {@code null}
     */
    public QueryReconnectionExhaustedException(int attempts, Throwable cause) {
        super("Reconnection failed after " + attempts + " consecutive attempts", cause);
        this.attempts = attempts;
    }

    /**
     * Returns the number of consecutive failed reconnection attempts.
     *
     * @return the attempt count
     */
    public int getAttempts() {
        return attempts;
    }
}
