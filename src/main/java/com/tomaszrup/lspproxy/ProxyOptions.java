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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session settings. Immutable; create through {@link #builder()} or
 * {@link ProxyOptionsParser#parse(com.google.gson.JsonObject)}.
 */
public final class ProxyOptions {

    static final Duration DEFAULT_PENDING_REQUEST_TIMEOUT = Duration.ofMinutes(10);
    static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(5);
    private static final Duration MIN_SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final Duration pendingRequestTimeout;
    private final Duration evictionSweepInterval;
    private final Duration shutdownGracePeriod;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final String sessionLabel;
    private final String logLevel;

    private ProxyOptions(Builder builder) {
        this.pendingRequestTimeout = builder.pendingRequestTimeout;
        this.evictionSweepInterval = builder.evictionSweepInterval;
        this.shutdownGracePeriod = builder.shutdownGracePeriod;
        this.workingDirectory = builder.workingDirectory;
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(builder.environment));
        this.sessionLabel = builder.sessionLabel;
        this.logLevel = builder.logLevel;
    }

    public static ProxyOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * How long a forwarded request may wait for its response before its
     * pending entry is evicted. {@link Duration#ZERO} disables eviction.
     */
    public Duration getPendingRequestTimeout() {
        return pendingRequestTimeout;
    }

    public boolean isEvictionEnabled() {
        return !pendingRequestTimeout.isZero() && !pendingRequestTimeout.isNegative();
    }

    /**
     * Period of the eviction sweep. Defaults to a fifth of the timeout, and
     * is never shorter than one second.
     */
    public Duration getEvictionSweepInterval() {
        Duration interval = evictionSweepInterval != null
                ? evictionSweepInterval
                : pendingRequestTimeout.dividedBy(5);
        return interval.compareTo(MIN_SWEEP_INTERVAL) < 0 ? MIN_SWEEP_INTERVAL : interval;
    }

    /**
     * How long the server gets to exit on its own after its stdin is closed,
     * and again after it is asked to terminate, before it is killed.
     */
    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    /** Working directory of the server process, or {@code null} to inherit ours. */
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /** Variables added to the server process environment. */
    public Map<String, String> getEnvironment() {
        return environment;
    }

    /** Label for the {@code session} MDC key, or {@code null} to derive it from the command. */
    public String getSessionLabel() {
        return sessionLabel;
    }

    /** Logback root level to apply when the proxy is built, or {@code null}. */
    public String getLogLevel() {
        return logLevel;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.pendingRequestTimeout = pendingRequestTimeout;
        builder.evictionSweepInterval = evictionSweepInterval;
        builder.shutdownGracePeriod = shutdownGracePeriod;
        builder.workingDirectory = workingDirectory;
        builder.environment.putAll(environment);
        builder.sessionLabel = sessionLabel;
        builder.logLevel = logLevel;
        return builder;
    }

    public static final class Builder {
        private Duration pendingRequestTimeout = DEFAULT_PENDING_REQUEST_TIMEOUT;
        private Duration evictionSweepInterval;
        private Duration shutdownGracePeriod = DEFAULT_SHUTDOWN_GRACE_PERIOD;
        private Path workingDirectory;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private String sessionLabel;
        private String logLevel;

        private Builder() {
        }

        public Builder pendingRequestTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative()) {
                throw new IllegalArgumentException("pendingRequestTimeout must be zero or positive");
            }
            this.pendingRequestTimeout = timeout;
            return this;
        }

        public Builder evictionSweepInterval(Duration interval) {
            this.evictionSweepInterval = interval;
            return this;
        }

        public Builder shutdownGracePeriod(Duration gracePeriod) {
            if (gracePeriod == null || gracePeriod.isNegative()) {
                throw new IllegalArgumentException("shutdownGracePeriod must be zero or positive");
            }
            this.shutdownGracePeriod = gracePeriod;
            return this;
        }

        public Builder workingDirectory(Path directory) {
            this.workingDirectory = directory;
            return this;
        }

        public Builder environment(String name, String value) {
            this.environment.put(name, value);
            return this;
        }

        public Builder sessionLabel(String label) {
            this.sessionLabel = label;
            return this;
        }

        public Builder logLevel(String level) {
            this.logLevel = level;
            return this;
        }

        public ProxyOptions build() {
            return new ProxyOptions(this);
        }
    }
}
