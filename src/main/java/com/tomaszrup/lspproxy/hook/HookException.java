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

import com.tomaszrup.lspproxy.ProxyErrorKind;
import com.tomaszrup.lspproxy.ProxyException;

/**
 * A hook invocation failed or returned something the router cannot forward.
 */
public class HookException extends ProxyException {

    private static final long serialVersionUID = 1L;

    private final HookPhase phase;
    private final String method;

    public HookException(HookPhase phase, String method, String message) {
        super(ProxyErrorKind.HOOK_FAILURE, message);
        this.phase = phase;
        this.method = method;
    }

    public HookException(HookPhase phase, String method, String message, Throwable cause) {
        super(ProxyErrorKind.HOOK_FAILURE, message, cause);
        this.phase = phase;
        this.method = method;
    }

    public HookPhase getPhase() {
        return phase;
    }

    /** The method the hook is registered under. */
    public String getMethod() {
        return method;
    }
}
