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
package com.tomaszrup.lspproxy.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspproxy.util.MdcSessionContext;

/**
 * A running language server. Exposes the protocol streams (stdin is
 * server-bound, stdout is server-originated), reports exit through
 * {@link #onExit()}, and logs everything the server writes to stderr.
 */
public class ServerProcess {

    private static final Logger logger = LoggerFactory.getLogger(ServerProcess.class);
    private static final Logger stderrLogger = LoggerFactory.getLogger(ServerProcess.class.getName() + ".stderr");

    private final Process process;
    private final List<String> commandLine;
    private final CompletableFuture<Integer> exit;
    private final Thread stderrPump;

    ServerProcess(Process process, List<String> commandLine) {
        this.process = process;
        this.commandLine = Collections.unmodifiableList(commandLine);
        this.exit = process.onExit().thenApply(Process::exitValue);
        InputStream stderr = process.getErrorStream();
        this.stderrPump = new Thread(MdcSessionContext.wrap(() -> pumpStderr(stderr)),
                "lspproxy-stderr-" + process.pid());
        this.stderrPump.setDaemon(true);
        this.stderrPump.start();
        this.exit.thenAccept(code -> logger.info("Language server (pid {}) exited with code {}", process.pid(), code));
    }

    /** Server-bound byte stream (the server's stdin). */
    public OutputStream getInput() {
        return process.getOutputStream();
    }

    /** Server-originated byte stream (the server's stdout). */
    public InputStream getOutput() {
        return process.getInputStream();
    }

    /** Completes with the exit code once the process has terminated. */
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public long pid() {
        return process.pid();
    }

    public List<String> getCommandLine() {
        return commandLine;
    }

    /**
     * Stops the server: closes its stdin and waits up to {@code gracePeriod}
     * for it to exit on its own, then asks it to terminate and waits again,
     * then kills it.
     *
     * @return the exit code, or {@code null} if the process was still alive
     *         after being killed and waited for
     */
    public Integer stop(Duration gracePeriod) {
        if (process.isAlive()) {
            try {
                process.getOutputStream().close();
            } catch (IOException e) {
                logger.debug("Failed to close language server stdin: {}", e.getMessage());
            }
            try {
                if (!process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.info("Language server (pid {}) did not exit, terminating it", process.pid());
                    process.destroy();
                    if (!process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                        logger.warn("Language server (pid {}) ignored termination, killing it", process.pid());
                        process.destroyForcibly();
                        process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
        try {
            stderrPump.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return process.isAlive() ? null : process.exitValue();
    }

    /**
     * Copies the server's stderr into the log, line by line.
     */
    private static void pumpStderr(InputStream inputStream) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                stderrLogger.info("{}", line);
            }
        } catch (IOException e) {
            logger.debug("Language server stderr closed: {}", e.getMessage());
        }
    }
}
