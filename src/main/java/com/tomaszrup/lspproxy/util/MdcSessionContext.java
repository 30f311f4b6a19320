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
package com.tomaszrup.lspproxy.util;

import java.util.Map;

import org.slf4j.MDC;

/**
 * Owns the SLF4J MDC keys {@code "session"} and {@code "direction"}, which the
 * logback pattern prints so that interleaved output from several sessions and
 * both forwarding loops can be told apart.
 *
 * <p>A forwarding loop tags its thread for as long as it runs:</p>
 * <pre>{@code
 * MdcSessionContext.setDirection("client->server");
 * try {
 *     router.pumpClientToServer(source);
 * } finally {
 *     MdcSessionContext.clearDirection();
 * }
 * }</pre>
 *
 * <p>Pool threads do not inherit the MDC, so callbacks handed to an executor
 * or a {@code CompletableFuture} go through {@link #wrap(Runnable)}:</p>
 * <pre>{@code
 * process.onExit().thenRun(MdcSessionContext.wrap(this::onProcessExit));
 * }</pre>
 */
public final class MdcSessionContext {

    /** MDC key used in the logback pattern via {@code %X{session}}. */
    public static final String SESSION_KEY = "session";

    /** MDC key used in the logback pattern via {@code %X{direction}}. */
    public static final String DIRECTION_KEY = "direction";

    private MdcSessionContext() {
        // utility class
    }

    /**
     * Sets the session label. A {@code null} or blank label is stored as
     * {@code "default"}.
     */
    public static void setSession(String label) {
        MDC.put(SESSION_KEY, label == null || label.isBlank() ? "default" : label);
    }

    public static void setDirection(String direction) {
        MDC.put(DIRECTION_KEY, direction);
    }

    public static void clearDirection() {
        MDC.remove(DIRECTION_KEY);
    }

    /**
     * Removes both keys from the current thread.
     */
    public static void clear() {
        MDC.remove(SESSION_KEY);
        MDC.remove(DIRECTION_KEY);
    }

    /**
     * Copies this thread's MDC entries, {@code null} when there are none.
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Replaces this thread's MDC with a map taken by {@link #snapshot()}.
     * {@code null} empties it.
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Binds {@code task} to the session and direction of the calling thread.
     * Whichever thread later runs it logs under those keys, and gets its own
     * entries back once the task returns.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }
}
