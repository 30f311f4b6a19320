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

import com.tomaszrup.lspproxy.ProxyErrorKind;
import com.tomaszrup.lspproxy.ProxyException;

/**
 * Raised when a frame cannot be decoded or its payload cannot be classified
 * as a request, response or notification. Ends the forwarding loop that read it.
 */
public class MalformedMessageException extends ProxyException {

    private static final long serialVersionUID = 1L;

    public MalformedMessageException(String message) {
        super(ProxyErrorKind.MALFORMED_MESSAGE, message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(ProxyErrorKind.MALFORMED_MESSAGE, message, cause);
    }
}
