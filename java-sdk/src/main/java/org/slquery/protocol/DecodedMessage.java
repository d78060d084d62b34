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
 * A message received from the server after the handshake.
 *
 * @param kind how the client routes the message
 * @param rawContentType the discriminator byte as received, read as unsigned
 * @param content the decoded text
 */
public record DecodedMessage(Kind kind, int rawContentType, String content) {

    /**
     * Routing category of an inbound message.
     */
    public enum Kind {
        CONSOLE_LINE,
        REMOTE_ADMIN_SUCCESS,
        REMOTE_ADMIN_FAILURE,
        COMMAND_EXCEPTION,
        UNRECOGNIZED;

        static Kind of(ContentTypeToClient contentType) {
            switch (contentType) {
                case CONSOLE_STRING:
                    return CONSOLE_LINE;
                case REMOTE_ADMIN_PLAINTEXT_RESPONSE:
                    return REMOTE_ADMIN_SUCCESS;
                case REMOTE_ADMIN_UNSUCCESSFUL_PLAINTEXT_RESPONSE:
                    return REMOTE_ADMIN_FAILURE;
                case COMMAND_EXCEPTION:
                    return COMMAND_EXCEPTION;
                default:
                    return UNRECOGNIZED;
            }
        }
    }

    public static DecodedMessage of(int rawContentType, String content) {
        return new DecodedMessage(Kind.of(ContentTypeToClient.fromCode(rawContentType)), rawContentType, content);
    }

    public static DecodedMessage unrecognized(int rawContentType) {
        return new DecodedMessage(Kind.UNRECOGNIZED, rawContentType, "");
    }

    public ContentTypeToClient contentType() {
        return ContentTypeToClient.fromCode(rawContentType);
    }

    /**
     * Returns whether this message resolves a pending command.
     *
     * @return true for remote admin responses and command exceptions
     */
    public boolean isCommandResult() {
        return kind == Kind.REMOTE_ADMIN_SUCCESS || kind == Kind.REMOTE_ADMIN_FAILURE || kind == Kind.COMMAND_EXCEPTION;
    }
}
