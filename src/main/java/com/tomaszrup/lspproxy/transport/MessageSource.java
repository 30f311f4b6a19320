////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspproxy.transport;

import java.io.Closeable;
import java.io.IOException;

import com.google.gson.JsonElement;
import com.tomaszrup.lspproxy.message.MalformedMessageException;

/**
 * One direction's incoming message stream, already de-framed into JSON values.
 */
public interface MessageSource extends Closeable {

    /**
     * Blocks until the next message is available.
     *
     * @return the decoded payload, or {@code null} at end of stream
     * @throws MalformedMessageException if the frame or its JSON is broken
     * @throws IOException if the underlying stream fails
     */
    JsonElement read() throws IOException, MalformedMessageException;

    /** Closes the source; a blocked {@link #read()} should return or fail promptly. */
    @Override
    void close();
}
