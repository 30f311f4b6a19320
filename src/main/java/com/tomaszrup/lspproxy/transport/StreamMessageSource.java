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
import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.tomaszrup.lspproxy.message.MalformedMessageException;

/**
 * {@link MessageSource} over a framed byte stream.
 */
public class StreamMessageSource implements MessageSource {

    private static final Logger logger = LoggerFactory.getLogger(StreamMessageSource.class);

    private final String name;
    private final MessageReader reader;

    public StreamMessageSource(String name, InputStream input) {
        this.name = name;
        this.reader = new MessageReader(input);
    }

    @Override
    public JsonElement read() throws IOException, MalformedMessageException {
        JsonElement payload = reader.read();
        if (payload != null && logger.isTraceEnabled()) {
            logger.trace("<-- {}: {}", name, payload);
        }
        return payload;
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (IOException e) {
            logger.debug("Failed to close {} input: {}", name, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
