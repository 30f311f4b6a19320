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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.tomaszrup.lspproxy.Protocol;

/**
 * Conversion between the JSON {@code error} member and lsp4j's {@link ResponseError}.
 */
final class ResponseErrors {

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    static ResponseError fromJson(JsonElement element) throws MalformedMessageException {
        if (!element.isJsonObject()) {
            throw new MalformedMessageException("Response error must be an object: " + Message.abbreviate(element));
        }
        JsonObject obj = element.getAsJsonObject();
        JsonElement code = obj.get(Protocol.ERROR_CODE);
        if (code == null || !code.isJsonPrimitive() || !code.getAsJsonPrimitive().isNumber()) {
            throw new MalformedMessageException("Response error code must be a number: " + Message.abbreviate(obj));
        }
        JsonElement message = obj.get(Protocol.ERROR_MESSAGE);
        ResponseError error = new ResponseError();
        error.setCode(code.getAsInt());
        error.setMessage(message != null && message.isJsonPrimitive() ? message.getAsString() : "");
        error.setData(obj.get(Protocol.ERROR_DATA));
        return error;
    }

    static JsonObject toJson(ResponseError error) {
        JsonObject obj = new JsonObject();
        obj.add(Protocol.ERROR_CODE, new JsonPrimitive(error.getCode()));
        obj.addProperty(Protocol.ERROR_MESSAGE, error.getMessage() != null ? error.getMessage() : "");
        Object data = error.getData();
        if (data instanceof JsonElement) {
            obj.add(Protocol.ERROR_DATA, (JsonElement) data);
        } else if (data != null) {
            obj.add(Protocol.ERROR_DATA, GSON.toJsonTree(data));
        }
        return obj;
    }

    private ResponseErrors() {
    }
}
