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
package com.tomaszrup.lspproxy.hook;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps method names to hooks. Filled before a session starts; the router only
 * calls {@link #lookup(String)}.
 */
public class HookRegistry {

    private final Map<String, Hook> hooks;

    public HookRegistry() {
        this.hooks = new LinkedHashMap<>();
    }

    private HookRegistry(Map<String, Hook> hooks) {
        this.hooks = hooks;
    }

    /**
     * Registers {@code hook} for {@code method}. A later registration for the
     * same method replaces the earlier one.
     *
     * @throws UnsupportedOperationException on a frozen registry
     */
    public HookRegistry register(String method, Hook hook) {
        if (method == null || hook == null) {
            throw new IllegalArgumentException("method and hook must not be null");
        }
        hooks.put(method, hook);
        return this;
    }

    /**
     * @return the hook for {@code method}, or empty when the method should be
     *         forwarded unmodified
     */
    public Optional<Hook> lookup(String method) {
        if (method == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(hooks.get(method));
    }

    public Set<String> methods() {
        return Collections.unmodifiableSet(hooks.keySet());
    }

    public int size() {
        return hooks.size();
    }

    /** Returns an immutable copy that is safe to share between threads. */
    public HookRegistry freeze() {
        return new HookRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(hooks)));
    }
}
