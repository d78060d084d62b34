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

import org.apache.commons.lang3.StringUtils;

/**
 * Exception thrown when the server explicitly rejects or fails a request.
 *
 * <p>Carries the text sent by the server, which is also part of the exception message.
 */
public class QueryServerException extends QueryException {

    private final String serverMessage;

    /**
     * Constructs a new QueryServerException.
     *
     * @param prefix the description of the failure
     * @param serverMessage the text sent by the server, may be empty
     */
    public QueryServerException(String prefix, String serverMessage) {
        super(buildMessage(prefix, serverMessage));
        this.serverMessage = StringUtils.defaultString(serverMessage);
    }

    /**
     * Returns the text sent by the server.
     *
     * @return the server message, never {@code null}
     */
    public String getServerMessage() {
        return serverMessage;
    }

    private static String buildMessage(String prefix, String serverMessage) {
        if (StringUtils.isBlank(serverMessage)) {
            return prefix;
        }
        return prefix + ": " + serverMessage;
    }
}
