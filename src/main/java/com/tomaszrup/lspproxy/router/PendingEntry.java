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
package com.tomaszrup.lspproxy.router;

import java.time.Instant;

import com.tomaszrup.lspproxy.message.MessageId;

/**
 * An in-flight client request: its id, the method it was forwarded with, and
 * when it was recorded.
 */
public final class PendingEntry {

    private final MessageId requestId;
    private final String method;
    private final Instant recordedAt;

    PendingEntry(MessageId requestId, String method, Instant recordedAt) {
        this.requestId = requestId;
        this.method = method;
        this.recordedAt = recordedAt;
    }

    public MessageId getRequestId() {
        return requestId;
    }

    public String getMethod() {
        return method;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public String toString() {
        return "PendingEntry{id=" + requestId + ", method=" + method + ", recordedAt=" + recordedAt + "}";
    }
}
