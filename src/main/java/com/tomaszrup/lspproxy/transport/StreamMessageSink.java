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

import java.io.IOException;
import java.io.OutputStream;

import org.eclipse.lsp4j.jsonrpc.JsonRpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspproxy.message.Message;

/**
 * {@link MessageSink} over a framed byte stream. The first failed write marks
 * the sink closed; later sends are dropped.
 */
public class StreamMessageSink implements MessageSink {

    private static final Logger logger = LoggerFactory.getLogger(StreamMessageSink.class);

    private final String name;
    private final MessageWriter writer;
    private volatile boolean closed;

    public StreamMessageSink(String name, OutputStream output) {
        this.name = name;
        this.writer = new MessageWriter(output);
    }

    @Override
    public boolean send(Message message) {
        if (closed) {
            logger.debug("Dropping message for closed {}: {}", name, message);
            return false;
        }
        try {
            writer.write(message.toJson());
            if (logger.isTraceEnabled()) {
                logger.trace("--> {}: {}", name, message);
            }
            return true;
        } catch (IOException e) {
            closed = true;
            if (JsonRpcException.indicatesStreamClosed(e)) {
                logger.debug("{} is closed, dropping message: {}", name, e.getMessage());
            } else {
                logger.warn("Failed to write to {}: {}", name, e.getMessage());
            }
            return false;
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            logger.debug("Failed to close {} output: {}", name, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
