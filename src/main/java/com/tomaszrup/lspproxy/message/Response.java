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

import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.tomaszrup.lspproxy.Protocol;

/**
 * The reply to a {@link Request}. Exactly one of {@link #getResult()} and
 * {@link #getError()} is set; a JSON {@code null} result is represented by
 * {@link JsonNull#INSTANCE}.
 */
public final class Response extends Message {

    private final MessageId id;
    private final JsonElement result;
    private final ResponseError error;

    Response(MessageId id, JsonElement result, ResponseError error, JsonObject source) {
        super(source);
        if (id == null) {
            throw new IllegalArgumentException("Response id must not be null, use MessageId.NULL");
        }
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Response must carry exactly one of result and error");
        }
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static Response success(MessageId id, JsonElement result) {
        return new Response(id, result != null ? result : JsonNull.INSTANCE, null, null);
    }

    public static Response failure(MessageId id, ResponseError error) {
        return new Response(id, null, error, null);
    }

    public static Response failure(MessageId id, ResponseErrorCode code, String message) {
        return failure(id, new ResponseError(code, message, null));
    }

    public MessageId getId() {
        return id;
    }

    public JsonElement getResult() {
        return result;
    }

    public ResponseError getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    public Response withResult(JsonElement newResult) {
        return success(id, newResult);
    }

    @Override
    public MessageKind getKind() {
        return MessageKind.RESPONSE;
    }

    @Override
    protected void writeMembers(JsonObject target) {
        target.add(Protocol.ID, id.toJson());
        if (error != null) {
            target.add(Protocol.ERROR, ResponseErrors.toJson(error));
        } else {
            target.add(Protocol.RESULT, result);
        }
    }
}
