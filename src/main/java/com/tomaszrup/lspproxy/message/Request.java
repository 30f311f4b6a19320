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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.lspproxy.Protocol;

/**
 * A call expecting a {@link Response} with the same id. The id may be
 * {@link MessageId#NULL} when a peer sends {@code "id": null}; such a request
 * is forwarded but never correlated.
 */
public final class Request extends Message {

    private final MessageId id;
    private final String method;
    private final JsonElement params;

    public Request(MessageId id, String method, JsonElement params) {
        this(id, method, params, null);
    }

    Request(MessageId id, String method, JsonElement params, JsonObject source) {
        super(source);
        if (id == null) {
            throw new IllegalArgumentException("Request id must not be null, use MessageId.NULL");
        }
        if (method == null) {
            throw new IllegalArgumentException("Request method must not be null");
        }
        this.id = id;
        this.method = method;
        this.params = params;
    }

    public MessageId getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    /** May be {@code null} when the request carries no params. */
    public JsonElement getParams() {
        return params;
    }

    public Request withParams(JsonElement newParams) {
        return new Request(id, method, newParams);
    }

    public Request withMethod(String newMethod) {
        return new Request(id, newMethod, params);
    }

    @Override
    public MessageKind getKind() {
        return MessageKind.REQUEST;
    }

    @Override
    protected void writeMembers(JsonObject target) {
        target.add(Protocol.ID, id.toJson());
        target.addProperty(Protocol.METHOD, method);
        if (params != null) {
            target.add(Protocol.PARAMS, params);
        }
    }
}
