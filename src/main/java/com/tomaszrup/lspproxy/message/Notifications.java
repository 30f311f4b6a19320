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

import java.util.Collections;

import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.tomaszrup.lspproxy.Protocol;

/**
 * Factory methods for the client notifications hooks most often emit.
 * Parameters are built from lsp4j types and serialized with lsp4j's own Gson
 * configuration, so enums such as {@link MessageType} go out as their
 * protocol integer values.
 */
public final class Notifications {

    private static final Gson GSON = new MessageJsonHandler(Collections.emptyMap()).getGson();

    /** {@code window/logMessage} */
    public static Notification logMessage(MessageType type, String message) {
        return Notification.of(Protocol.NOTIFICATION_LOG_MESSAGE, toParams(new MessageParams(type, message)));
    }

    /** {@code window/showMessage} */
    public static Notification showMessage(MessageType type, String message) {
        return Notification.of(Protocol.NOTIFICATION_SHOW_MESSAGE, toParams(new MessageParams(type, message)));
    }

    /** Any notification whose params are an lsp4j (or other Gson-serializable) object. */
    public static Notification of(String method, Object params) {
        return Notification.of(method, params != null ? toParams(params) : null);
    }

    private static JsonElement toParams(Object params) {
        return GSON.toJsonTree(params);
    }

    private Notifications() {
    }
}
