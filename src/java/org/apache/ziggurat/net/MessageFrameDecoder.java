/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.ziggurat.net;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.MessageCodec;
import org.apache.ziggurat.protocol.MessageHeader;
import org.apache.ziggurat.protocol.ProtocolException;

/**
 * Splits the inbound byte stream into {@link Message}s. The header is decoded (and validated) as soon as its 24 bytes
 * are in, the body once all of it is buffered; a trivial state machine remembers which one we are waiting for.
 * <p>
 * Decoding failures are not handled here: they percolate up to netty, get wrapped in a
 * {@link io.netty.handler.codec.DecoderException} and reach {@link ConnectionErrorHandler}, which closes the channel.
 * Once that happened, any remaining input is discarded.
 */
class MessageFrameDecoder extends ByteToMessageDecoder
{
    private static final Logger logger = LoggerFactory.getLogger(MessageFrameDecoder.class);

    private enum State
    {
        READ_HEADER,
        READ_BODY,
        FAILED
    }

    private final MessageCodec codec;
    private final NodeMetrics metrics;

    private State state = State.READ_HEADER;
    private MessageHeader header;

    MessageFrameDecoder(MessageCodec codec, NodeMetrics metrics)
    {
        this.codec = codec;
        this.metrics = metrics;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        try
        {
            switch (state)
            {
                case READ_HEADER:
                    if (in.readableBytes() < MessageHeader.LENGTH)
                        return;
                    header = codec.decodeHeader(in);
                    state = State.READ_BODY;
                    // fall-through
                case READ_BODY:
                    if (in.readableBytes() < header.bodyLength)
                        return;
                    Message message = codec.decodeBody(header, in.readSlice((int) header.bodyLength));
                    header = null;
                    state = State.READ_HEADER;
                    metrics.messageReceived();
                    logger.trace("received {} from {}", message, ctx.channel().remoteAddress());
                    out.add(message);
                    break;
                case FAILED:
                    in.skipBytes(in.readableBytes());
                    break;
            }
        }
        catch (ProtocolException e)
        {
            state = State.FAILED;
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }
}
