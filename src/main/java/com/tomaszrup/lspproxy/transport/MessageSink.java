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

import com.tomaszrup.lspproxy.message.Message;

/**
 * One direction's outgoing message stream. Implementations must be safe to
 * call from several threads; each message is written whole.
 */
public interface MessageSink extends Closeable {

    /**
     * Writes one message.
     *
     * @return {@code false} if the destination is closed. The message is then
     *         dropped and every later call also returns {@code false}.
     */
    boolean send(Message message);

    boolean isClosed();

    @Override
    void close();
}
