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

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.messages.AddrMessage;
import org.apache.ziggurat.protocol.messages.GetDataMessage;
import org.apache.ziggurat.protocol.messages.InvMessage;
import org.apache.ziggurat.protocol.messages.PingMessage;
import org.apache.ziggurat.protocol.messages.VerackMessage;

/**
 * Decides, per message type, what a node does with the messages it receives once connections are ready.
 * <p>
 * Under {@link AutoReply#ALL}, every type that has a canonical reply (see {@link #canonicalReply(Message)}) defaults to
 * {@link Action#AUTO_REPLY}; everything else is {@link Action#DELIVER}ed. Overrides replace the default of their type.
 */
public class MessageFilter
{
    public enum AutoReply
    {
        NONE,
        ALL
    }

    public enum Action
    {
        /** hand the message to the scenario */
        DELIVER,
        /** answer the message and hand it to the scenario */
        AUTO_REPLY,
        /** answer the message, scenario never sees it */
        AUTO_REPLY_AND_DROP,
        DROP
    }

    private static final Set<Message.Type> REPLYABLE = Collections.unmodifiableSet(EnumSet.of(Message.Type.PING,
                                                                                              Message.Type.VERSION,
                                                                                              Message.Type.GETADDR,
                                                                                              Message.Type.GETDATA,
                                                                                              Message.Type.GETBLOCKS,
                                                                                              Message.Type.MEMPOOL));

    private final Map<Message.Type, Action> actions = new EnumMap<>(Message.Type.class);

    public MessageFilter(AutoReply autoReply, Map<Message.Type, Action> overrides)
    {
        for (Message.Type type : Message.Type.values())
            actions.put(type, autoReply == AutoReply.ALL && REPLYABLE.contains(type) ? Action.AUTO_REPLY : Action.DELIVER);

        for (Map.Entry<Message.Type, Action> override : overrides.entrySet())
        {
            Action action = override.getValue();
            Preconditions.checkArgument(!replies(action) || REPLYABLE.contains(override.getKey()),
                                        "%s messages have no canonical reply", override.getKey());
            actions.put(override.getKey(), action);
        }
    }

    public Action action(Message.Type type)
    {
        return actions.get(type);
    }

    static boolean replies(Action action)
    {
        return action == Action.AUTO_REPLY || action == Action.AUTO_REPLY_AND_DROP;
    }

    public static boolean hasCanonicalReply(Message.Type type)
    {
        return REPLYABLE.contains(type);
    }

    /**
     * The answer a well behaved node with nothing to offer would give to {@code message}, or null if the message
     * does not call for one.
     */
    @Nullable
    public static Message canonicalReply(Message message)
    {
        switch (message.type)
        {
            case PING:
                return ((PingMessage) message).reply();
            case VERSION:
                return new VerackMessage();
            case GETADDR:
                return AddrMessage.empty();
            case GETDATA:
                return ((GetDataMessage) message).notFound();
            case GETBLOCKS:
            case MEMPOOL:
                return InvMessage.empty();
            default:
                return null;
        }
    }

    @Override
    public String toString()
    {
        return "MessageFilter" + actions;
    }
}
