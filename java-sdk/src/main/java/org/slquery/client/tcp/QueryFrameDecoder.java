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

package org.slquery.client.tcp;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.TooLongFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decoder for query protocol frames.
 * Frame format: [4-byte length LE] [payload]
 *
 * <p>Emits the payload of each complete frame. A frame announcing a payload larger than the
 * configured maximum fails the connection with a {@link TooLongFrameException}.
 */
public class QueryFrameDecoder extends ByteToMessageDecoder {
    private static final Logger log = LoggerFactory.getLogger(QueryFrameDecoder.class);
    static final int HEADER_SIZE = 4;

    private final int maxFrameSize;

    public QueryFrameDecoder(int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws TooLongFrameException {
        if (in.readableBytes() < HEADER_SIZE) {
            return;
        }

        in.markReaderIndex();
        long length = in.readUnsignedIntLE();

        if (length > maxFrameSize) {
            in.skipBytes(in.readableBytes());
            throw new TooLongFrameException(
                    "Frame payload of " + length + " bytes exceeds the limit of " + maxFrameSize + " bytes");
        }

        if (in.readableBytes() < length) {
            in.resetReaderIndex();
            return;
        }

        log.trace("Decoded frame with payload length={}", length);
        out.add(in.readRetainedSlice((int) length));
    }
}
