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
package org.apache.ziggurat.protocol.messages;

import java.util.Objects;
import javax.annotation.Nullable;

import io.netty.buffer.ByteBuf;

import org.apache.ziggurat.protocol.Hash;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.WireUtil;

/**
 * Tells the peer one of its messages was rejected. For rejected blocks and transactions, the body ends with the
 * hash of the offending object; for other messages there is nothing after the reason.
 */
public class RejectMessage extends Message
{
    public static final int REJECT_MALFORMED = 0x01;
    public static final int REJECT_INVALID = 0x10;
    public static final int REJECT_OBSOLETE = 0x11;
    public static final int REJECT_DUPLICATE = 0x12;
    public static final int REJECT_NONSTANDARD = 0x40;
    public static final int REJECT_DUST = 0x41;
    public static final int REJECT_INSUFFICIENTFEE = 0x42;
    public static final int REJECT_CHECKPOINT = 0x43;

    public static final Message.Codec<RejectMessage> codec = new Message.Codec<RejectMessage>()
    {
        public RejectMessage decode(ByteBuf body)
        {
            String message = WireUtil.readString(body);
            int ccode = WireUtil.readUnsignedByte(body);
            String reason = WireUtil.readString(body);
            Hash data = body.isReadable() ? WireUtil.readHash(body) : null;
            return new RejectMessage(message, ccode, reason, data);
        }

        public void encode(RejectMessage msg, ByteBuf out)
        {
            WireUtil.writeString(out, msg.message);
            out.writeByte(msg.ccode);
            WireUtil.writeString(out, msg.reason);
            if (msg.data != null)
                WireUtil.writeHash(out, msg.data);
        }
    };

    /** command of the rejected message */
    public final String message;
    public final int ccode;
    public final String reason;
    @Nullable
    public final Hash data;

    public RejectMessage(String message, int ccode, String reason, @Nullable Hash data)
    {
        super(Message.Type.REJECT);
        this.message = Objects.requireNonNull(message);
        this.ccode = ccode & 0xff;
        this.reason = Objects.requireNonNull(reason);
        this.data = data;
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof RejectMessage))
            return false;

        RejectMessage that = (RejectMessage) other;
        return this.message.equals(that.message)
            && this.ccode == that.ccode
            && this.reason.equals(that.reason)
            && Objects.equals(this.data, that.data);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(message, ccode, reason, data);
    }

    @Override
    public String toString()
    {
        return String.format("REJECT %s (0x%02x): %s%s", message, ccode, reason, data == null ? "" : " " + data);
    }
}
