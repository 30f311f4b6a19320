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
package com.tomaszrup.lspproxy.router;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import org.eclipse.lsp4j.jsonrpc.JsonRpcException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.tomaszrup.lspproxy.ProxyErrorKind;
import com.tomaszrup.lspproxy.hook.Hook;
import com.tomaszrup.lspproxy.hook.HookException;
import com.tomaszrup.lspproxy.hook.HookInvoker;
import com.tomaszrup.lspproxy.hook.HookRegistry;
import com.tomaszrup.lspproxy.message.HookOutput;
import com.tomaszrup.lspproxy.message.MalformedMessageException;
import com.tomaszrup.lspproxy.message.Message;
import com.tomaszrup.lspproxy.message.MessageId;
import com.tomaszrup.lspproxy.message.Notification;
import com.tomaszrup.lspproxy.message.Request;
import com.tomaszrup.lspproxy.message.Response;
import com.tomaszrup.lspproxy.transport.MessageSink;
import com.tomaszrup.lspproxy.transport.MessageSource;

/**
 * The two forwarding loops of a proxy session.
 *
 * <p>{@link #pumpClientToServer} and {@link #pumpServerToClient} each run on
 * their own thread and share only the {@link PendingRequestTable}. Within one
 * direction messages are handled strictly in arrival order and a message is
 * forwarded only after its hook has completed, so a slow hook holds back the
 * rest of its own direction (and only that direction).</p>
 *
 * <p>Client requests pass through the request hook registered for their
 * method and are recorded in the pending table before they are written to
 * the server. Hook notifications are written to the client first. Server
 * responses are correlated through the table and pass through the response
 * hook of the originating method; their hook notifications follow them.
 * Notifications, server-initiated requests and client responses are never
 * intercepted.</p>
 */
public class MessageRouter {

    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private final HookRegistry hooks;
    private final PendingRequestTable pendingRequests;
    private final HookInvoker hookInvoker;
    private final MessageSink toServer;
    private final MessageSink toClient;

    private volatile boolean stopped;

    public MessageRouter(HookRegistry hooks, PendingRequestTable pendingRequests,
                         MessageSink toServer, MessageSink toClient) {
        this(hooks, pendingRequests, new HookInvoker(), toServer, toClient);
    }

    public MessageRouter(HookRegistry hooks, PendingRequestTable pendingRequests, HookInvoker hookInvoker,
                         MessageSink toServer, MessageSink toClient) {
        this.hooks = hooks;
        this.pendingRequests = pendingRequests;
        this.hookInvoker = hookInvoker;
        this.toServer = toServer;
        this.toClient = toClient;
    }

    /**
     * Forwards client messages to the server until the client stream ends,
     * a destination closes, or the router is stopped.
     *
     * @throws MalformedMessageException if the client sends something that is
     *         not a protocol message; the loop ends
     */
    public PumpExit pumpClientToServer(MessageSource fromClient) throws MalformedMessageException {
        return pump(Direction.CLIENT_TO_SERVER, fromClient);
    }

    /**
     * Forwards server messages to the client until the server stream ends,
     * the client closes, or the router is stopped.
     *
     * @throws MalformedMessageException if the server sends something that is
     *         not a protocol message; the loop ends
     */
    public PumpExit pumpServerToClient(MessageSource fromServer) throws MalformedMessageException {
        return pump(Direction.SERVER_TO_CLIENT, fromServer);
    }

    /**
     * Asks both loops to return. A loop blocked in a read only notices once
     * the read returns, so callers also close the sources.
     */
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    private PumpExit pump(Direction direction, MessageSource source) throws MalformedMessageException {
        logger.debug("Forwarding {} started", direction);
        while (!stopped) {
            JsonElement raw;
            try {
                raw = source.read();
            } catch (IOException e) {
                if (stopped) {
                    return PumpExit.STOPPED;
                }
                if (JsonRpcException.indicatesStreamClosed(e)) {
                    logger.debug("{} source closed: {}", direction, e.getMessage());
                } else {
                    logger.warn("[{}] {} source failed, treating it as closed: {}",
                            ProxyErrorKind.STREAM_CLOSED, direction, e.getMessage());
                }
                return PumpExit.END_OF_STREAM;
            }
            if (raw == null) {
                logger.info("[{}] {} source reached end of stream", ProxyErrorKind.STREAM_CLOSED, direction);
                return PumpExit.END_OF_STREAM;
            }
            if (stopped) {
                logger.debug("{} stopped, discarding {}", direction, raw);
                break;
            }
            Message message = Message.classify(raw);
            boolean open = direction == Direction.CLIENT_TO_SERVER
                    ? handleFromClient(message)
                    : handleFromServer(message);
            if (!open) {
                logger.info("[{}] {} destination closed", ProxyErrorKind.STREAM_CLOSED, direction);
                return PumpExit.DESTINATION_CLOSED;
            }
        }
        return PumpExit.STOPPED;
    }

    /**
     * Routes one message read from the client.
     *
     * @return {@code false} once a destination refuses a write
     */
    boolean handleFromClient(Message message) {
        switch (message.getKind()) {
            case REQUEST:
                return forwardRequest((Request) message);
            case RESPONSE:
                // answer to a server-initiated request
                return toServer.send(message);
            case NOTIFICATION:
            default:
                return toServer.send(message);
        }
    }

    /**
     * Routes one message read from the server.
     *
     * @return {@code false} once a destination refuses a write
     */
    boolean handleFromServer(Message message) {
        switch (message.getKind()) {
            case RESPONSE:
                return forwardResponse((Response) message);
            case REQUEST:
                // server-initiated request, not correlated
                return toClient.send(message);
            case NOTIFICATION:
            default:
                return toClient.send(message);
        }
    }

    private boolean forwardRequest(Request request) {
        Optional<Hook> hook = hooks.lookup(request.getMethod());
        if (hook.isEmpty()) {
            recordPending(request);
            return toServer.send(request);
        }

        HookOutput<Request> output;
        try {
            output = hookInvoker.invokeRequestHook(hook.get(), request);
        } catch (HookException e) {
            logger.warn("[{}] Request hook for {} (id {}) failed, answering the client with an error: {}",
                    e.getKind(), request.getMethod(), request.getId(), e.getMessage());
            logger.debug("Request hook failure details", e);
            return toClient.send(hookFailureResponse(request, e));
        }

        if (!sendAll(toClient, output.getNotifications())) {
            return false;
        }
        Request forwarded = output.getMessage();
        recordPending(forwarded);
        return toServer.send(forwarded);
    }

    private boolean forwardResponse(Response response) {
        MessageId id = response.getId();
        if (id.isNull()) {
            logger.warn("[{}] Server sent a response with a null id, forwarding unmodified: {}",
                    ProxyErrorKind.UNMATCHED_RESPONSE, response);
            return toClient.send(response);
        }

        Optional<String> method = pendingRequests.resolve(id);
        if (method.isEmpty()) {
            logger.warn("[{}] No in-flight request for response id {}, forwarding unmodified",
                    ProxyErrorKind.UNMATCHED_RESPONSE, id);
            return toClient.send(response);
        }
        Optional<Hook> hook = hooks.lookup(method.get());
        if (hook.isEmpty()) {
            return toClient.send(response);
        }

        HookOutput<Response> output;
        try {
            output = hookInvoker.invokeResponseHook(hook.get(), method.get(), response);
        } catch (HookException e) {
            logger.warn("[{}] Response hook for {} (id {}) failed, forwarding the original response: {}",
                    e.getKind(), method.get(), id, e.getMessage());
            logger.debug("Response hook failure details", e);
            return toClient.send(response);
        }

        if (!toClient.send(output.getMessage())) {
            return false;
        }
        return sendAll(toClient, output.getNotifications());
    }

    private void recordPending(Request request) {
        if (request.getId().isNull()) {
            logger.warn("Request {} has a null id, forwarding it without correlation", request.getMethod());
            return;
        }
        PendingEntry displaced = pendingRequests.record(request.getId(), request.getMethod());
        if (displaced != null) {
            logger.warn("[{}] Request id {} is already in flight: {} replaces pending {}",
                    ProxyErrorKind.DUPLICATE_IN_FLIGHT_ID, request.getId(), request.getMethod(),
                    displaced.getMethod());
        }
    }

    private static boolean sendAll(MessageSink sink, List<Notification> notifications) {
        for (Notification notification : notifications) {
            if (!sink.send(notification)) {
                return false;
            }
        }
        return true;
    }

    static Response hookFailureResponse(Request request, HookException failure) {
        String message = "Proxy hook for '" + request.getMethod() + "' failed: " + failure.getMessage();
        return Response.failure(request.getId(), ResponseErrorCode.InternalError, message);
    }
}
