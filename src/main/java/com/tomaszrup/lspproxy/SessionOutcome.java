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
 * How a proxy session ended, when it ended normally.
 */
public final class SessionOutcome {

    public enum EndReason {
        /** The client stream reached end of input. */
        CLIENT_CLOSED,
        /** The server stream reached end of input while the server process (if any) was still running. */
        SERVER_CLOSED,
        /** The server process terminated. */
        PROCESS_EXITED,
        /** A destination refused a write. */
        DESTINATION_CLOSED,
        /** {@link ProxySession#stop()} was called. */
        STOPPED
    }

    private final EndReason reason;
    private final Integer exitCode;
    private final int unansweredRequests;

    SessionOutcome(EndReason reason, Integer exitCode, int unansweredRequests) {
        this.reason = reason;
        this.exitCode = exitCode;
        this.unansweredRequests = unansweredRequests;
    }

    public EndReason getReason() {
        return reason;
    }

    /** Exit code of the server process; {@code null} without a process or if it could not be stopped. */
    public Integer getExitCode() {
        return exitCode;
    }

    /** Requests still waiting for a response when the session ended. */
    public int getUnansweredRequests() {
        return unansweredRequests;
    }

    @Override
    public String toString() {
        return "SessionOutcome{reason=" + reason + ", exitCode=" + exitCode
                + ", unansweredRequests=" + unansweredRequests + "}";
    }
}
