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

import java.time.Duration;

/**
 * Exception thrown when no response arrives for a command within its timeout.
 *
 * <p>The connection stays open; only the command that timed out is abandoned.
 */
public class QueryTimeoutException extends QueryClientException {

    private final Duration timeout;

    /**
     * Constructs a new QueryTimeoutException.
     *
     * @param timeout the timeout that elapsed
     */
    public QueryTimeoutException(Duration timeout) {
        super("No response received within " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    /**
     * Returns the timeout that elapsed.
     *
     * @return the timeout
     */
    public Duration getTimeout() {
        return timeout;
    }
}
