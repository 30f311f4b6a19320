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

import java.util.concurrent.CompletableFuture;

import com.tomaszrup.lspproxy.message.HookOutput;
import com.tomaszrup.lspproxy.message.Request;
import com.tomaszrup.lspproxy.message.Response;

/**
 * Method-scoped interceptor. Registered in a {@link HookRegistry} under a
 * method name, it sees every client request with that method on its way to
 * the server, and the server's response to each of those requests on its way
 * back.
 *
 * <p>Both capabilities default to identity, so a hook only overrides the
 * side it cares about. A hook may complete its future later (after I/O, for
 * example); the router waits for it, which delays only the direction the
 * message travels in. One instance serves every invocation for its method,
 * from both forwarding threads, so any state it keeps must be thread-safe.</p>
 *
 * <p>Failing is done by throwing or by completing the future exceptionally.
 * A failed request hook answers the client with an internal-error response
 * and the request is not forwarded; a failed response hook lets the original
 * server response through.</p>
 */
public interface Hook {

    /**
     * Called before a request is forwarded to the server. The returned
     * request is what the server receives; it may carry a different method
     * name or params than the original.
     */
    default CompletableFuture<HookOutput<Request>> onRequest(Request request) {
        return CompletableFuture.completedFuture(HookOutput.of(request));
    }

    /**
     * Called before a response is forwarded to the client. The returned
     * response must keep the id of the one passed in.
     */
    default CompletableFuture<HookOutput<Response>> onResponse(Response response) {
        return CompletableFuture.completedFuture(HookOutput.of(response));
    }
}
