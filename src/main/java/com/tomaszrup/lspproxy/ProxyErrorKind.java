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
package com.tomaszrup.lspproxy;

/**
 * Classification of the failures the proxy can observe. Only some of them
 * are fatal to a session; see {@link ProxySession} for the policy.
 */
public enum ProxyErrorKind {
    /** Unparseable frame or a payload that is neither request, response nor notification. */
    MALFORMED_MESSAGE,
    /** A response whose id has no in-flight request. Recovered by forwarding. */
    UNMATCHED_RESPONSE,
    /** A request id recorded while an earlier request with that id is still in flight. */
    DUPLICATE_IN_FLIGHT_ID,
    /** A hook threw, failed its future, or broke its contract. */
    HOOK_FAILURE,
    /** A source or destination stream ended. */
    STREAM_CLOSED,
    /** The language server process terminated. */
    PROCESS_EXIT,
    /** The language server process could not be started. */
    PROCESS_SPAWN_FAILURE
}
