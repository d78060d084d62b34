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
 * Status byte of the final handshake frame.
 */
public enum HandshakeStatus {
    ACCEPTED(0),
    REJECTED_PASSWORD(1),
    REJECTED(-1);

    private final int code;

    HandshakeStatus(int code) {
        this.code = code;
    }

    /**
     * Returns the status for the given wire code. Any code other than accepted or a password
     * rejection is a generic rejection.
     *
     * @param code the status byte, read as unsigned
     * @return the status
     */
    public static HandshakeStatus fromCode(int code) {
        if (code == ACCEPTED.code) {
            return ACCEPTED;
        }
        if (code == REJECTED_PASSWORD.code) {
            return REJECTED_PASSWORD;
        }
        return REJECTED;
    }

    public int asCode() {
        return code;
    }
}
