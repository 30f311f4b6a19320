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
 * A one-way message. Carries no id and is never correlated or intercepted.
 */
public final class Notification extends Message {

    private final String method;
    private final JsonElement params;

    public Notification(String method, JsonElement params) {
        this(method, params, null);
    }

    Notification(String method, JsonElement params, JsonObject source) {
        super(source);
        if (method == null) {
            throw new IllegalArgumentException("Notification method must not be null");
        }
        this.method = method;
        this.params = params;
    }

    public static Notification of(String method, JsonElement params) {
        return new Notification(method, params);
    }

    public String getMethod() {
        return method;
    }

    /** May be {@code null} when the notification carries no params. */
    public JsonElement getParams() {
        return params;
    }

    @Override
    public MessageKind getKind() {
        return MessageKind.NOTIFICATION;
    }

    @Override
    protected void writeMembers(JsonObject target) {
        target.addProperty(Protocol.METHOD, method);
        if (params != null) {
            target.add(Protocol.PARAMS, params);
        }
    }
}
