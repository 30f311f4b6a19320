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

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;

import org.eclipse.lsp4j.jsonrpc.json.MessageConstants;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tomaszrup.lspproxy.message.MalformedMessageException;

/**
 * Reads base-protocol frames ({@code Content-Length} header block, blank line,
 * JSON body) from a byte stream, one message per {@link #read()}.
 *
 * <p>Header names are matched case-insensitively. A {@code charset} parameter
 * in {@code Content-Type} selects the body encoding, UTF-8 otherwise. Not
 * thread-safe: each reader belongs to one forwarding loop.</p>
 */
public class MessageReader {

    private static final int MAX_HEADER_LINE = 8192;

    private final InputStream input;

    public MessageReader(InputStream input) {
        this.input = input instanceof BufferedInputStream ? input : new BufferedInputStream(input);
    }

    /**
     * @return the next decoded payload, or {@code null} if the stream ended
     *         cleanly between two frames
     * @throws MalformedMessageException on a broken header block, a body
     *         shorter than announced, or a body that is not JSON
     */
    public JsonElement read() throws IOException, MalformedMessageException {
        int contentLength = -1;
        Charset charset = StandardCharsets.UTF_8;
        boolean sawHeader = false;

        while (true) {
            String line = readLine(sawHeader);
            if (line == null) {
                return null;
            }
            if (line.isEmpty()) {
                if (!sawHeader) {
                    // stray blank line between frames
                    continue;
                }
                break;
            }
            sawHeader = true;
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new MalformedMessageException("Invalid header line: " + line);
            }
            String name = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            if (name.equalsIgnoreCase(MessageConstants.CONTENT_LENGTH_HEADER)) {
                contentLength = parseContentLength(value);
            } else if (name.equalsIgnoreCase(MessageConstants.CONTENT_TYPE_HEADER)) {
                charset = parseCharset(value);
            }
        }

        if (contentLength < 0) {
            throw new MalformedMessageException("Missing " + MessageConstants.CONTENT_LENGTH_HEADER + " header");
        }
        byte[] body = input.readNBytes(contentLength);
        if (body.length < contentLength) {
            throw new MalformedMessageException("Unexpected end of stream: expected " + contentLength
                    + " bytes of content, got " + body.length);
        }
        try {
            return JsonParser.parseString(new String(body, charset));
        } catch (JsonParseException e) {
            throw new MalformedMessageException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    public void close() throws IOException {
        input.close();
    }

    /**
     * Reads one CRLF-terminated header line.
     *
     * @return the line without its terminator, or {@code null} on end of
     *         stream before any byte of a frame was read
     */
    private String readLine(boolean insideFrame) throws IOException, MalformedMessageException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        while (true) {
            int c = input.read();
            if (c == -1) {
                if (!insideFrame && buffer.size() == 0) {
                    return null;
                }
                throw new MalformedMessageException("Unexpected end of stream inside header block");
            }
            if (c == '\r') {
                int next = input.read();
                if (next == '\n') {
                    return buffer.toString(StandardCharsets.US_ASCII);
                }
                if (next == -1) {
                    throw new MalformedMessageException("Unexpected end of stream inside header block");
                }
                buffer.write(c);
                buffer.write(next);
            } else if (c == '\n') {
                // tolerate bare LF terminators
                return buffer.toString(StandardCharsets.US_ASCII);
            } else {
                buffer.write(c);
            }
            if (buffer.size() > MAX_HEADER_LINE) {
                throw new MalformedMessageException("Header line exceeds " + MAX_HEADER_LINE + " bytes");
            }
        }
    }

    private static int parseContentLength(String value) throws MalformedMessageException {
        try {
            int length = Integer.parseInt(value);
            if (length < 0) {
                throw new MalformedMessageException("Negative Content-Length: " + value);
            }
            return length;
        } catch (NumberFormatException e) {
            throw new MalformedMessageException("Invalid Content-Length: " + value, e);
        }
    }

    private static Charset parseCharset(String contentType) throws MalformedMessageException {
        for (String part : contentType.split(";")) {
            String param = part.trim();
            if (param.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = param.substring("charset=".length()).trim().replace("\"", "");
                // "utf8" is what some VS Code versions send
                if (name.equalsIgnoreCase("utf8")) {
                    return StandardCharsets.UTF_8;
                }
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    throw new MalformedMessageException("Unsupported charset: " + name, e);
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
