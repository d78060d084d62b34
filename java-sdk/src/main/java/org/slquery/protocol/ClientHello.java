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

import java.util.Optional;

/**
 * Handshake frame sent by the client in reply to {@link ServerHello}.
 *
 * @param flags the requested capabilities
 * @param permissions the requested permission bitset
 * @param kickPower the requested kick power, 0 to 255
 * @param username the username for server side logging, written only with
 *                 {@link ClientFlag#SPECIFY_LOG_USERNAME}
 * @param proof the password proof over the server challenge
 */
public record ClientHello(
        ClientFlags flags, long permissions, int kickPower, Optional<String> username, byte[] proof) {}
