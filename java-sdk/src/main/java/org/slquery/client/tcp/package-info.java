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

/**
 * Netty-based TCP implementation of the query client.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link org.slquery.client.tcp.QueryTcpClient}: the client; owns the event loop group
 *       shared by all of its connections</li>
 *   <li>{@link org.slquery.client.tcp.QueryTcpClientBuilder}: fluent builder validating the
 *       connection settings</li>
 *   <li>{@link org.slquery.client.tcp.QueryTcpConnector}: opens a channel and runs the
 *       handshake on it</li>
 * </ul>
 *
 * <h2>Protocol Details</h2>
 * <p>Every frame is {@code [length:4 LE][payload:N]}. After the handshake a payload is
 * {@code [contentType:1][UTF-8 text]}. Responses carry no request identifier, so commands are
 * executed one at a time.
 *
 * @see org.slquery.client.tcp.QueryTcpClient
 */
package org.slquery.client.tcp;
