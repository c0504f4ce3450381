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
package org.apache.ziggurat.protocol;

/**
 * The checksum carried in a message header does not match the one computed over the received body.
 */
public class ChecksumMismatchException extends ProtocolException
{
    public final String command;
    public final int expected;
    public final int actual;

    public ChecksumMismatchException(String command, int expected, int actual)
    {
        super(String.format("Checksum mismatch for '%s' message: header says 0x%08x, body hashes to 0x%08x", command, expected, actual));
        this.command = command;
        this.expected = expected;
        this.actual = actual;
    }
}
