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
 * Content type discriminator of messages sent by the server.
 *
 * <p>Codes the client does not know map to {@link #UNKNOWN}, so newer servers can introduce
 * message types without breaking older clients.
 */
public enum ContentTypeToClient {
    CONSOLE_STRING(0),
    COMMAND_EXCEPTION(1),
    REMOTE_ADMIN_SERIALIZED_RESPONSE(2),
    REMOTE_ADMIN_PLAINTEXT_RESPONSE(3),
    REMOTE_ADMIN_UNSUCCESSFUL_PLAINTEXT_RESPONSE(4),
    UNKNOWN(-1);

    private final int code;

    ContentTypeToClient(int code) {
        this.code = code;
    }

    /**
     * Returns the content type for the given wire code, or {@link #UNKNOWN}.
     *
     * @param code the discriminator byte, read as unsigned
     * @return the content type, never {@code null}
     */
    public static ContentTypeToClient fromCode(int code) {
        for (ContentTypeToClient type : values()) {
            if (type.code == code && type != UNKNOWN) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public int asCode() {
        return code;
    }
}
