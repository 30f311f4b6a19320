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

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspproxy.hook.Hook;
import com.tomaszrup.lspproxy.hook.HookRegistry;
import com.tomaszrup.lspproxy.process.ProcessSupervisor;
import com.tomaszrup.lspproxy.process.ServerProcess;
import com.tomaszrup.lspproxy.router.MessageRouter;
import com.tomaszrup.lspproxy.router.PendingRequestTable;
import com.tomaszrup.lspproxy.transport.MessageSink;
import com.tomaszrup.lspproxy.transport.MessageSource;
import com.tomaszrup.lspproxy.transport.StreamMessageSink;
import com.tomaszrup.lspproxy.transport.StreamMessageSource;

/**
 * Entry point of the proxy. Sits between an editor and a language server,
 * forwarding protocol traffic both ways and running the registered
 * {@link Hook}s on requests and responses of their method.
 *
 * <pre>{@code
 * LspProxy proxy = LspProxy.builder()
 *         .withHook("textDocument/hover", new HoverHook())
 *         .build();
 * SessionOutcome outcome = proxy.spawn("groovy-language-server", List.of(), System.in, System.out);
 * }</pre>
 *
 * <p>Hooks are fixed when the proxy is built. A proxy can run any number of
 * sessions; each session has its own pending-request table and threads.</p>
 */
public final class LspProxy {

    private static final Logger logger = LoggerFactory.getLogger(LspProxy.class);

    private final HookRegistry hooks;
    private final ProxyOptions options;
    private final ProcessSupervisor supervisor;

    private LspProxy(HookRegistry hooks, ProxyOptions options, ProcessSupervisor supervisor) {
        this.hooks = hooks;
        this.options = options;
        this.supervisor = supervisor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the language server and proxies between it and the client
     * until the session ends.
     *
     * @param clientReader bytes from the editor
     * @param clientWriter bytes to the editor
     * @throws ProxyException if the server cannot be started (no forwarding
     *         happens then) or the session fails, e.g. on a malformed message
     */
    public SessionOutcome spawn(String command, List<String> args, InputStream clientReader,
                                OutputStream clientWriter) throws ProxyException, InterruptedException {
        return start(command, args, clientReader, clientWriter).awaitTermination();
    }

    /**
     * Non-blocking {@link #spawn}: starts the server and the session and
     * returns the running session.
     */
    public ProxySession start(String command, List<String> args, InputStream clientReader,
                              OutputStream clientWriter) throws ProxyException {
        ServerProcess process = supervisor.spawn(command, args, options);
        String label = options.getSessionLabel() != null ? options.getSessionLabel() : labelFor(command);
        return open(label,
                new StreamMessageSource("client", clientReader), new StreamMessageSink("client", clientWriter),
                new StreamMessageSource("server", process.getOutput()), new StreamMessageSink("server", process.getInput()),
                process);
    }

    /**
     * Proxies between a client and a server that is already reachable
     * through streams (a socket, for instance) until the session ends.
     */
    public SessionOutcome forward(InputStream serverReader, OutputStream serverWriter,
                                  InputStream clientReader, OutputStream clientWriter)
            throws ProxyException, InterruptedException {
        return startForwarding(serverReader, serverWriter, clientReader, clientWriter).awaitTermination();
    }

    /**
     * Non-blocking {@link #forward}.
     */
    public ProxySession startForwarding(InputStream serverReader, OutputStream serverWriter,
                                        InputStream clientReader, OutputStream clientWriter) {
        return open(options.getSessionLabel() != null ? options.getSessionLabel() : "stream",
                new StreamMessageSource("client", clientReader), new StreamMessageSink("client", clientWriter),
                new StreamMessageSource("server", serverReader), new StreamMessageSink("server", serverWriter),
                null);
    }

    /**
     * Starts a session over arbitrary message streams.
     */
    public ProxySession open(MessageSource clientSource, MessageSink clientSink,
                             MessageSource serverSource, MessageSink serverSink) {
        return open(options.getSessionLabel() != null ? options.getSessionLabel() : "custom",
                clientSource, clientSink, serverSource, serverSink, null);
    }

    private ProxySession open(String label, MessageSource clientSource, MessageSink clientSink,
                              MessageSource serverSource, MessageSink serverSink, ServerProcess process) {
        PendingRequestTable pendingRequests = new PendingRequestTable();
        MessageRouter router = new MessageRouter(hooks, pendingRequests, serverSink, clientSink);
        ProxySession session = new ProxySession(label, router, pendingRequests,
                clientSource, clientSink, serverSource, serverSink, process, options);
        session.start();
        return session;
    }

    public HookRegistry getHooks() {
        return hooks;
    }

    public ProxyOptions getOptions() {
        return options;
    }

    static String labelFor(String command) {
        try {
            Path fileName = Paths.get(command).getFileName();
            return fileName != null ? fileName.toString() : command;
        } catch (RuntimeException e) {
            return command;
        }
    }

    public static final class Builder {
        private final HookRegistry hooks = new HookRegistry();
        private ProxyOptions options = ProxyOptions.defaults();
        private ProcessSupervisor supervisor = new ProcessSupervisor();

        private Builder() {
        }

        /** Registers {@code hook} for {@code method}; a later registration for the same method wins. */
        public Builder withHook(String method, Hook hook) {
            hooks.register(method, hook);
            return this;
        }

        public Builder withOptions(ProxyOptions options) {
            this.options = options;
            return this;
        }

        public Builder withProcessSupervisor(ProcessSupervisor supervisor) {
            this.supervisor = supervisor;
            return this;
        }

        public LspProxy build() {
            if (options.getLogLevel() != null) {
                ProxyOptionsParser.applyLogLevel(options.getLogLevel());
            }
            HookRegistry frozen = hooks.freeze();
            logger.debug("Proxy built with hooks for {}", frozen.methods());
            return new LspProxy(frozen, options, supervisor);
        }
    }
}
