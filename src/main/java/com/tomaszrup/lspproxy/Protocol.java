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
 * JSON-RPC member names and LSP method names the proxy relies on.
 */
public final class Protocol {
	public static final String JSONRPC = "jsonrpc";
	public static final String ID = "id";
	public static final String METHOD = "method";
	public static final String PARAMS = "params";
	public static final String RESULT = "result";
	public static final String ERROR = "error";

	public static final String ERROR_CODE = "code";
	public static final String ERROR_MESSAGE = "message";
	public static final String ERROR_DATA = "data";

	public static final String NOTIFICATION_LOG_MESSAGE = "window/logMessage";
	public static final String NOTIFICATION_SHOW_MESSAGE = "window/showMessage";

	private Protocol() {
	}
}
