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
package com.tomaszrup.lspproxy.message;

import org.eclipse.lsp4j.jsonrpc.json.MessageConstants;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.lspproxy.Protocol;

/**
 * A JSON-RPC message travelling through the proxy: a {@link Request}, a
 * {@link Response} or a {@link Notification}.
 *
 * <p>Messages produced by {@link #classify(JsonElement)} remember the JSON
 * object they were read from and serialize back to it unchanged, so that
 * anything the proxy does not touch is forwarded exactly as received
 * (including members the model does not know about). Messages built in code,
 * e.g. by hooks, are serialized from their fields.</p>
 */
public abstract class Message {

    private final JsonObject source;

    Message(JsonObject source) {
        this.source = source;
    }

    public abstract MessageKind getKind();

    /** Writes the message fields into a fresh JSON-RPC object. */
    protected abstract void writeMembers(JsonObject target);

    /**
     * Returns the JSON form of this message. For a message read from the
     * wire this is the original object.
     */
    public JsonObject toJson() {
        if (source != null) {
            return source;
        }
        JsonObject json = new JsonObject();
        json.addProperty(Protocol.JSONRPC, MessageConstants.JSONRPC_VERSION);
        writeMembers(json);
        return json;
    }

    /**
     * Classifies a decoded payload.
     * <ul>
     *   <li>{@code method} without {@code id}: notification</li>
     *   <li>{@code method} with {@code id}: request</li>
     *   <li>{@code id} without {@code method}, with exactly one of
     *       {@code result} / {@code error}: response</li>
     * </ul>
     * Anything else is malformed. {@code "result": null} counts as a present
     * result and {@code "error": null} as an absent error. A request whose id
     * is JSON {@code null} is still a request; it just cannot be correlated.
     *
     * @throws MalformedMessageException if the payload fits none of the shapes
     */
    public static Message classify(JsonElement raw) throws MalformedMessageException {
        if (raw == null || !raw.isJsonObject()) {
            throw new MalformedMessageException("Message must be a JSON object: " + abbreviate(raw));
        }
        JsonObject obj = raw.getAsJsonObject();

        boolean hasId = obj.has(Protocol.ID);
        boolean hasMethod = obj.has(Protocol.METHOD);
        boolean hasResult = obj.has(Protocol.RESULT);
        boolean hasError = obj.has(Protocol.ERROR) && !obj.get(Protocol.ERROR).isJsonNull();
        JsonElement params = obj.get(Protocol.PARAMS);

        String method = null;
        if (hasMethod) {
            JsonElement methodElement = obj.get(Protocol.METHOD);
            if (!methodElement.isJsonPrimitive() || !methodElement.getAsJsonPrimitive().isString()) {
                throw new MalformedMessageException("Message method must be a string: " + abbreviate(obj));
            }
            method = methodElement.getAsString();
        }

        MessageId id = null;
        if (hasId) {
            id = MessageId.fromJson(obj.get(Protocol.ID));
            if (id == null) {
                throw new MalformedMessageException("Message id must be a string or a number: " + abbreviate(obj));
            }
        }

        if (hasMethod && !hasResult && !hasError) {
            if (!hasId) {
                return new Notification(method, params, obj);
            }
            return new Request(id, method, params, obj);
        } else if (hasId && !hasMethod && hasResult != hasError) {
            if (hasResult) {
                return new Response(id, obj.get(Protocol.RESULT), null, obj);
            }
            return new Response(id, null, ResponseErrors.fromJson(obj.get(Protocol.ERROR)), obj);
        }
        throw new MalformedMessageException("Invalid message format: " + abbreviate(obj));
    }

    static String abbreviate(JsonElement element) {
        String text = String.valueOf(element);
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
