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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a hook hands back to the router: the (possibly rewritten) message to
 * keep forwarding, and notifications to deliver to the client in list order.
 *
 * <p>For a request the notifications reach the client before the request is
 * forwarded to the server; for a response they follow the response.</p>
 *
 * @param <M> {@link Request} for request hooks, {@link Response} for response hooks
 */
public final class HookOutput<M extends Message> {

    private final M message;
    private final List<Notification> notifications = new ArrayList<>();

    private HookOutput(M message) {
        this.message = message;
    }

    /** Wraps a message with no notifications. */
    public static <M extends Message> HookOutput<M> of(M message) {
        return new HookOutput<>(message);
    }

    public HookOutput<M> withNotification(Notification notification) {
        addNotification(notification);
        return this;
    }

    public HookOutput<M> withNotifications(List<Notification> additional) {
        for (Notification notification : additional) {
            addNotification(notification);
        }
        return this;
    }

    public void addNotification(Notification notification) {
        if (notification == null) {
            throw new IllegalArgumentException("notification must not be null");
        }
        notifications.add(notification);
    }

    public M getMessage() {
        return message;
    }

    public List<Notification> getNotifications() {
        return Collections.unmodifiableList(notifications);
    }
}
