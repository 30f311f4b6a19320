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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspproxy.SessionOutcome.EndReason;
import com.tomaszrup.lspproxy.message.MalformedMessageException;
import com.tomaszrup.lspproxy.process.ServerProcess;
import com.tomaszrup.lspproxy.router.Direction;
import com.tomaszrup.lspproxy.router.MessageRouter;
import com.tomaszrup.lspproxy.router.PendingEntry;
import com.tomaszrup.lspproxy.router.PendingRequestTable;
import com.tomaszrup.lspproxy.router.PumpExit;
import com.tomaszrup.lspproxy.transport.MessageSink;
import com.tomaszrup.lspproxy.transport.MessageSource;
import com.tomaszrup.lspproxy.util.MdcSessionContext;

/**
 * One running proxy session: the two forwarding loops, the optional server
 * process, and the pending-request eviction sweep.
 *
 * <p>The first of these events ends the whole session: either loop
 * returning (end of stream, closed destination, malformed input), the
 * server process exiting, or {@link #stop()}. Ending stops the router,
 * closes every stream the session was given, stops the server process and
 * completes {@link #awaitTermination()}. A half-open session is never kept.</p>
 */
public class ProxySession {

    private static final Logger logger = LoggerFactory.getLogger(ProxySession.class);

    private final String label;
    private final MessageRouter router;
    private final PendingRequestTable pendingRequests;
    private final MessageSource clientSource;
    private final MessageSink clientSink;
    private final MessageSource serverSource;
    private final MessageSink serverSink;
    private final ServerProcess process;
    private final ProxyOptions options;
    private final ProxyExecutors executors = new ProxyExecutors();

    private final CompletableFuture<SessionOutcome> outcome = new CompletableFuture<>();
    private final AtomicBoolean finishing = new AtomicBoolean();
    private volatile ScheduledFuture<?> evictionFuture;

    ProxySession(String label, MessageRouter router, PendingRequestTable pendingRequests,
                 MessageSource clientSource, MessageSink clientSink,
                 MessageSource serverSource, MessageSink serverSink,
                 ServerProcess process, ProxyOptions options) {
        this.label = label;
        this.router = router;
        this.pendingRequests = pendingRequests;
        this.clientSource = clientSource;
        this.clientSink = clientSink;
        this.serverSource = serverSource;
        this.serverSink = serverSink;
        this.process = process;
        this.options = options;
    }

    void start() {
        Map<String, String> previous = MdcSessionContext.snapshot();
        MdcSessionContext.setSession(label);
        try {
            logger.info("Proxy session started");
            executors.getPumpPool().execute(() -> runPump(Direction.CLIENT_TO_SERVER));
            executors.getPumpPool().execute(() -> runPump(Direction.SERVER_TO_CLIENT));

            if (options.isEvictionEnabled()) {
                long sweepMillis = options.getEvictionSweepInterval().toMillis();
                evictionFuture = executors.getSchedulingPool().scheduleWithFixedDelay(
                        this::evictStalePendingRequests, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
            }
            if (process != null) {
                process.onExit().thenRun(MdcSessionContext.wrap(this::onProcessExit));
            }
        } finally {
            MdcSessionContext.restore(previous);
        }
    }

    /**
     * Blocks until the session has ended.
     *
     * @throws ProxyException the first fatal error of the session, e.g. a
     *         malformed message
     */
    public SessionOutcome awaitTermination() throws ProxyException, InterruptedException {
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    /**
     * Like {@link #awaitTermination()} but gives up after {@code timeout}.
     */
    public SessionOutcome awaitTermination(long timeout, TimeUnit unit)
            throws ProxyException, InterruptedException, TimeoutException {
        try {
            return outcome.get(timeout, unit);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    /** Completes when the session has ended; fails with the session's fatal error. */
    public CompletableFuture<SessionOutcome> onTermination() {
        return outcome.copy();
    }

    /**
     * Ends the session. Hooks that are running are allowed to finish, but
     * their output is dropped once the streams are closed.
     */
    public void stop() {
        finish(EndReason.STOPPED, null);
    }

    public boolean isRunning() {
        return !finishing.get();
    }

    public String getLabel() {
        return label;
    }

    /** Number of requests currently waiting for a server response. */
    public int getPendingRequestCount() {
        return pendingRequests.size();
    }

    private void runPump(Direction direction) {
        MdcSessionContext.setDirection(direction.getLabel());
        try {
            PumpExit exit = direction == Direction.CLIENT_TO_SERVER
                    ? router.pumpClientToServer(clientSource)
                    : router.pumpServerToClient(serverSource);
            finish(endReason(direction, exit), null);
        } catch (MalformedMessageException e) {
            logger.error("Malformed message from the {}, ending session: {}",
                    direction == Direction.CLIENT_TO_SERVER ? "client" : "server", e.getMessage());
            finish(null, e);
        } catch (RuntimeException e) {
            logger.error("Forwarding {} failed unexpectedly", direction, e);
            finish(null, e);
        } catch (Error e) {
            logger.error("Forwarding {} died", direction, e);
            finish(null, e);
            throw e;
        } finally {
            MdcSessionContext.clearDirection();
        }
    }

    private void onProcessExit() {
        logger.info("[{}] Language server process exited", ProxyErrorKind.PROCESS_EXIT);
        // Let the server-to-client loop drain what the server wrote before
        // exiting; it normally ends the session itself on end of stream.
        try {
            executors.getSchedulingPool().schedule(
                    () -> finish(EndReason.PROCESS_EXITED, null),
                    options.getShutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Session already ending when the server exited");
        }
    }

    private void evictStalePendingRequests() {
        List<PendingEntry> evicted = pendingRequests.evictOlderThan(options.getPendingRequestTimeout());
        for (PendingEntry entry : evicted) {
            logger.warn("No response to {} (id {}) within {}s, dropping its pending entry",
                    entry.getMethod(), entry.getRequestId(), options.getPendingRequestTimeout().toSeconds());
        }
    }

    private void finish(EndReason reason, Throwable failure) {
        if (!finishing.compareAndSet(false, true)) {
            return;
        }
        if (failure == null) {
            logger.info("Proxy session ending: {}", reason);
        }
        router.stop();
        ScheduledFuture<?> eviction = evictionFuture;
        if (eviction != null) {
            eviction.cancel(false);
        }

        // Closing the server's stdin is the polite way to ask it to exit.
        serverSink.close();
        clientSource.close();
        serverSource.close();

        Integer exitCode = null;
        if (process != null) {
            exitCode = process.stop(options.getShutdownGracePeriod());
            if (reason == EndReason.SERVER_CLOSED && !process.isAlive()) {
                reason = EndReason.PROCESS_EXITED;
            }
        }
        clientSink.close();

        int unanswered = pendingRequests.clear();
        if (unanswered > 0) {
            logger.info("{} request(s) were still waiting for a response", unanswered);
        }
        executors.shutdownAll();

        if (failure != null) {
            outcome.completeExceptionally(failure);
        } else {
            SessionOutcome result = new SessionOutcome(reason, exitCode, unanswered);
            logger.info("Proxy session ended: {}", result);
            outcome.complete(result);
        }
    }

    private static EndReason endReason(Direction direction, PumpExit exit) {
        switch (exit) {
            case END_OF_STREAM:
                return direction == Direction.CLIENT_TO_SERVER ? EndReason.CLIENT_CLOSED : EndReason.SERVER_CLOSED;
            case DESTINATION_CLOSED:
                return EndReason.DESTINATION_CLOSED;
            case STOPPED:
            default:
                return EndReason.STOPPED;
        }
    }

    private static ProxyException rethrow(Throwable cause) {
        if (cause instanceof ProxyException) {
            return (ProxyException) cause;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new IllegalStateException("Unexpected checked throwable", cause);
    }
}
