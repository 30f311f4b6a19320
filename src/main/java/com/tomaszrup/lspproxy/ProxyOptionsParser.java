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

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link ProxyOptions} from a JSON object, e.g. a section of the
 * embedding application's settings. Unknown keys and values of the wrong
 * type are ignored.
 */
public final class ProxyOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(ProxyOptionsParser.class);

    private static final String PENDING_REQUEST_TIMEOUT_OPTION = "pendingRequestTimeoutSeconds";
    private static final String EVICTION_SWEEP_INTERVAL_OPTION = "evictionSweepIntervalSeconds";
    private static final String SHUTDOWN_GRACE_PERIOD_OPTION = "shutdownGracePeriodSeconds";
    private static final String WORKING_DIRECTORY_OPTION = "workingDirectory";
    private static final String ENVIRONMENT_OPTION = "environment";
    private static final String SESSION_LABEL_OPTION = "sessionLabel";
    private static final String LOG_LEVEL_OPTION = "logLevel";

    /**
     * @param opts the options object; {@code null} yields the defaults
     */
    public static ProxyOptions parse(JsonObject opts) {
        ProxyOptions.Builder builder = ProxyOptions.builder();
        if (opts == null) {
            return builder.build();
        }

        Long timeout = parseSeconds(opts, PENDING_REQUEST_TIMEOUT_OPTION);
        if (timeout != null) {
            builder.pendingRequestTimeout(Duration.ofSeconds(timeout));
            logger.info("Pending request timeout: {}s", timeout);
        }
        Long sweep = parseSeconds(opts, EVICTION_SWEEP_INTERVAL_OPTION);
        if (sweep != null) {
            builder.evictionSweepInterval(Duration.ofSeconds(sweep));
        }
        Long grace = parseSeconds(opts, SHUTDOWN_GRACE_PERIOD_OPTION);
        if (grace != null) {
            builder.shutdownGracePeriod(Duration.ofSeconds(grace));
        }

        String workingDirectory = parseString(opts, WORKING_DIRECTORY_OPTION);
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            builder.workingDirectory(Paths.get(workingDirectory));
        }
        if (opts.has(ENVIRONMENT_OPTION) && opts.get(ENVIRONMENT_OPTION).isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : opts.getAsJsonObject(ENVIRONMENT_OPTION).entrySet()) {
                if (entry.getValue().isJsonPrimitive()) {
                    builder.environment(entry.getKey(), entry.getValue().getAsString());
                }
            }
        }
        builder.sessionLabel(parseString(opts, SESSION_LABEL_OPTION));
        builder.logLevel(parseString(opts, LOG_LEVEL_OPTION));
        return builder.build();
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }

    private static Long parseSeconds(JsonObject opts, String key) {
        if (!opts.has(key) || !opts.get(key).isJsonPrimitive() || !opts.get(key).getAsJsonPrimitive().isNumber()) {
            return null;
        }
        long value = opts.get(key).getAsLong();
        if (value < 0) {
            logger.warn("Ignoring negative {}: {}", key, value);
            return null;
        }
        return value;
    }

    private static String parseString(JsonObject opts, String key) {
        if (opts.has(key) && opts.get(key).isJsonPrimitive()) {
            return opts.get(key).getAsString();
        }
        return null;
    }

    private ProxyOptionsParser() {
        // utility class
    }
}
