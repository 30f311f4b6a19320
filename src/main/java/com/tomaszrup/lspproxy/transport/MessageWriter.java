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
import java.nio.charset.StandardCharsets;

import org.eclipse.lsp4j.jsonrpc.json.MessageConstants;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;

/**
 * Writes base-protocol frames. Writes are serialized so that messages from
 * both forwarding loops never interleave on a shared stream.
 */
public class MessageWriter {

    // Null members must survive ("result": null is a valid response).
    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private final OutputStream output;

    public MessageWriter(OutputStream output) {
        this.output = output;
    }

    public synchronized void write(JsonElement payload) throws IOException {
        byte[] content = GSON.toJson(payload).getBytes(StandardCharsets.UTF_8);
        String header = MessageConstants.CONTENT_LENGTH_HEADER + ": " + content.length
                + MessageConstants.CRLF + MessageConstants.CRLF;
        output.write(header.getBytes(StandardCharsets.US_ASCII));
        output.write(content);
        output.flush();
    }

    public synchronized void close() throws IOException {
        output.close();
    }
}
