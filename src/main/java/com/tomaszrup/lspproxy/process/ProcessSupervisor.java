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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspproxy.ProxyErrorKind;
import com.tomaszrup.lspproxy.ProxyException;
import com.tomaszrup.lspproxy.ProxyOptions;

/**
 * Starts language server processes. The returned {@link ServerProcess} owns
 * the child; the supervisor keeps no reference to it and never restarts it.
 */
public class ProcessSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ProcessSupervisor.class);

    /**
     * Starts {@code command} with {@code args}. The server's stdin and stdout
     * carry the protocol; its stderr is logged.
     *
     * @throws ProxyException of kind {@link ProxyErrorKind#PROCESS_SPAWN_FAILURE}
     *         if the process cannot be started
     */
    public ServerProcess spawn(String command, List<String> args, ProxyOptions options) throws ProxyException {
        if (command == null || command.isBlank()) {
            throw new ProxyException(ProxyErrorKind.PROCESS_SPAWN_FAILURE, "No server command given");
        }
        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        if (args != null) {
            commandLine.addAll(args);
        }

        ProcessBuilder pb = new ProcessBuilder(commandLine)
                .redirectErrorStream(false);
        if (options.getWorkingDirectory() != null) {
            pb.directory(options.getWorkingDirectory().toFile());
        }
        pb.environment().putAll(options.getEnvironment());

        Process process;
        try {
            process = pb.start();
        } catch (IOException | SecurityException | UnsupportedOperationException e) {
            throw new ProxyException(ProxyErrorKind.PROCESS_SPAWN_FAILURE,
                    "Failed to start language server " + commandLine + ": " + e.getMessage(), e);
        }
        logger.info("Started language server (pid {}): {}", process.pid(), commandLine);
        return new ServerProcess(process, commandLine);
    }
}
