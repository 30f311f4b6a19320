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

import java.math.BigDecimal;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;

/**
 * Opaque JSON-RPC message identifier (string or number).
 *
 * <p>The original JSON value is kept so it can be written back exactly as it
 * was received. Equality is computed on a normalized key, so {@code 1},
 * {@code 1.0} and a {@code long} 1 are the same id while the string
 * {@code "1"} is not.</p>
 *
 * <p>{@link #NULL} represents the {@code "id": null} a peer sends when it could
 * not read the id of a broken request. It never matches a pending request.</p>
 */
public final class MessageId {

    public static final MessageId NULL = new MessageId(JsonNull.INSTANCE, "null");

    private final JsonElement value;
    private final String key;

    private MessageId(JsonElement value, String key) {
        this.value = value;
        this.key = key;
    }

    public static MessageId of(String id) {
        return new MessageId(new JsonPrimitive(id), "s:" + id);
    }

    public static MessageId of(long id) {
        return new MessageId(new JsonPrimitive(id), "n:" + id);
    }

    /**
     * Reads an id from its JSON form.
     *
     * @return the id, or {@code null} if the element is neither a string,
     *         a number nor JSON {@code null}
     */
    public static MessageId fromJson(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return NULL;
        }
        if (!element.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isString()) {
            return new MessageId(primitive, "s:" + primitive.getAsString());
        }
        if (primitive.isNumber()) {
            return new MessageId(primitive, "n:" + normalizeNumber(primitive));
        }
        return null;
    }

    private static String normalizeNumber(JsonPrimitive primitive) {
        try {
            return new BigDecimal(primitive.getAsString()).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            return primitive.getAsString();
        }
    }

    public boolean isNull() {
        return this == NULL || value.isJsonNull();
    }

    public JsonElement toJson() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MessageId)) {
            return false;
        }
        return key.equals(((MessageId) obj).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
