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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.eclipse.lsp4j.MessageType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.tomaszrup.lspproxy.ProxyErrorKind;
import com.tomaszrup.lspproxy.hook.Hook;
import com.tomaszrup.lspproxy.hook.HookException;
import com.tomaszrup.lspproxy.hook.HookPhase;
import com.tomaszrup.lspproxy.hook.HookRegistry;
import com.tomaszrup.lspproxy.message.HookOutput;
import com.tomaszrup.lspproxy.message.MalformedMessageException;
import com.tomaszrup.lspproxy.message.Message;
import com.tomaszrup.lspproxy.message.MessageId;
import com.tomaszrup.lspproxy.message.Notification;
import com.tomaszrup.lspproxy.message.Notifications;
import com.tomaszrup.lspproxy.message.Request;
import com.tomaszrup.lspproxy.message.Response;
import com.tomaszrup.lspproxy.transport.QueueMessageSource;
import com.tomaszrup.lspproxy.transport.RecordingMessageSink;

/**
 * Tests for {@link MessageRouter}: hook dispatch, correlation, failure
 * handling and the order in which the client sees messages.
 */
class MessageRouterTests {

	private static final String HOVER = "textDocument/hover";
	private static final String COMPLETION = "textDocument/completion";
	private static final String DEFINITION = "textDocument/definition";

	private List<String> journal;
	private RecordingMessageSink toServer;
	private RecordingMessageSink toClient;
	private HookRegistry hooks;
	private PendingRequestTable pending;
	private ExecutorService executor;

	@BeforeEach
	void setup() {
		journal = Collections.synchronizedList(new ArrayList<>());
		toServer = new RecordingMessageSink("server", journal);
		toClient = new RecordingMessageSink("client", journal);
		hooks = new HookRegistry();
		pending = new PendingRequestTable();
		executor = Executors.newFixedThreadPool(2);
	}

	@AfterEach
	void tearDown() {
		executor.shutdownNow();
	}

	private MessageRouter router() {
		return new MessageRouter(hooks.freeze(), pending, toServer, toClient);
	}

	private static Message parse(String json) throws MalformedMessageException {
		return Message.classify(JsonParser.parseString(json));
	}

	private static Response responseFor(Request request, String result) {
		return Response.success(request.getId(), new JsonPrimitive(result));
	}

	// ------------------------------------------------------------------
	// Scenarios
	// ------------------------------------------------------------------

	@Test
	void testRequestHookNotificationPrecedesResponse() throws Exception {
		hooks.register(HOVER, new Hook() {
			@Override
			public CompletableFuture<HookOutput<Request>> onRequest(Request request) {
				return CompletableFuture.completedFuture(HookOutput.of(request)
						.withNotification(Notifications.logMessage(MessageType.Log, "hover requested")));
			}
		});
		MessageRouter router = router();
		Message request = parse("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"textDocument/hover\",\"params\":{}}");

		Assertions.assertTrue(router.handleFromClient(request));
		Assertions.assertTrue(router.handleFromServer(parse("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"docs\"}")));

		Assertions.assertEquals(3, journal.size());
		Assertions.assertTrue(journal.get(0).startsWith("client:") && journal.get(0).contains("window/logMessage"),
				journal.get(0));
		Assertions.assertTrue(journal.get(1).startsWith("server:") && journal.get(1).contains(HOVER), journal.get(1));
		Assertions.assertTrue(journal.get(2).startsWith("client:") && journal.get(2).contains("docs"), journal.get(2));
		Assertions.assertEquals(0, pending.size());
	}

	@Test
	void testUnhookedTrafficIsForwardedUnmodified() throws Exception {
		MessageRouter router = router();
		Message request = parse("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"textDocument/completion\",\"params\":{\"x\":1}}");
		Message response = parse("{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":[{\"label\":\"a\"}]}");

		router.handleFromClient(request);
		Assertions.assertTrue(pending.contains(MessageId.of(2)));
		router.handleFromServer(response);

		Assertions.assertSame(request, toServer.getMessages().get(0));
		Assertions.assertEquals(request.toJson(), toServer.getMessages().get(0).toJson());
		Assertions.assertSame(response, toClient.getMessages().get(0));
		Assertions.assertEquals(0, pending.size());
	}

	@Test
	void testUnmatchedResponseIsForwarded() throws Exception {
		MessageRouter router = router();
		Message response = parse("{\"jsonrpc\":\"2.0\",\"id\":99,\"result\":{}}");

		Assertions.assertTrue(router.handleFromServer(response));

		Assertions.assertEquals(List.of(response), toClient.getMessages());
		Assertions.assertTrue(toServer.getMessages().isEmpty());
	}

	@Test
	void testResponseHookFailureForwardsOriginal() throws Exception {
		hooks.register(DEFINITION, new Hook() {
			@Override
			public CompletableFuture<HookOutput<Response>> onResponse(Response response) {
				throw new IllegalStateException("cannot post-process");
			}
		});
		MessageRouter router = router();
		router.handleFromClient(parse("{\"id\":5,\"method\":\"textDocument/definition\"}"));
		Message response = parse("{\"id\":5,\"result\":[]}");

		Assertions.assertTrue(router.handleFromServer(response));

		Assertions.assertEquals(List.of(response), toClient.getMessages());
		Assertions.assertEquals(0, pending.size());
	}

	@Test
	void testOutOfOrderResponsesReachTheirOwnHooks() throws Exception {
		List<String> seen = new CopyOnWriteArrayList<>();
		hooks.register(HOVER, taggingResponseHook("hover", seen));
		hooks.register(COMPLETION, taggingResponseHook("completion", seen));
		MessageRouter router = router();

		router.handleFromClient(parse("{\"id\":1,\"method\":\"textDocument/hover\"}"));
		router.handleFromClient(parse("{\"id\":2,\"method\":\"textDocument/completion\"}"));
		router.handleFromServer(parse("{\"id\":2,\"result\":\"r2\"}"));
		router.handleFromServer(parse("{\"id\":1,\"result\":\"r1\"}"));

		Assertions.assertEquals(List.of("completion:2", "hover:1"), seen);
		List<Message> delivered = toClient.getMessages();
		Assertions.assertEquals("completion:r2", ((Response) delivered.get(0)).getResult().getAsString());
		Assertions.assertEquals("hover:r1", ((Response) delivered.get(1)).getResult().getAsString());
	}

	private static Hook taggingResponseHook(String tag, List<String> seen) {
		return new Hook() {
			@Override
			public CompletableFuture<HookOutput<Response>> onResponse(Response response) {
				seen.add(tag + ":" + response.getId());
				String result = tag + ":" + response.getResult().getAsString();
				return CompletableFuture.completedFuture(HookOutput.of(response.withResult(new JsonPrimitive(result))));
			}
		};
	}

	// ------------------------------------------------------------------
	// Request hooks
	// ------------------------------------------------------------------

	@Test
	void testRequestHookRewriteReachesServer() throws Exception {
		hooks.register(HOVER, new Hook() {
			@Override
			public CompletableFuture<HookOutput<Request>> onRequest(Request request) {
				JsonObject params = new JsonObject();
				params.addProperty("rewritten", true);
				return CompletableFuture.completedFuture(HookOutput.of(request.withParams(params)));
			}
		});
		MessageRouter router = router();

		router.handleFromClient(parse("{\"id\":\"h1\",\"method\":\"textDocument/hover\",\"params\":{}}"));

		Request forwarded = (Request) toServer.getMessages().get(0);
		Assertions.assertTrue(forwarded.getParams().getAsJsonObject().get("rewritten").getAsBoolean());
		Assertions.assertEquals(MessageId.of("h1"), forwarded.getId());
	}

	@Test
	void testRenamedRequestIsCorrelatedUnderNewMethod() throws Exception {
		List<String> seen = new CopyOnWriteArrayList<>();
		hooks.register(HOVER, new Hook() {
			@Override
			public CompletableFuture<HookOutput<Request>> onRequest(Request request) {
				return CompletableFuture.completedFuture(HookOutput.of(request.withMethod(DEFINITION)));
			}
		});
		hooks.register(DEFINITION, taggingResponseHook("definition", seen));
		MessageRouter router = router();

		router.handleFromClient(parse("{\"id\":3,\"method\":\"textDocument/hover\"}"));
		router.handleFromServer(parse("{\"id\":3,\"result\":\"x\"}"));

		Assertions.assertEquals(List.of("definition:3"), seen);
	}

	@Test
	void testRequestHookFailureAnswersClientWithInternalError() throws Exception {
		hooks.register(HOVER, new Hook() {
			@Override
			public CompletableFuture<HookOutput<Request>> onRequest(Request request) {
				return CompletableFuture.failedFuture(new IllegalArgumentException("bad position"));
			}
		});
		MessageRouter router = router();

		Assertions.assertTrue(router.handleFromClient(parse("{\"id\":4,\"method\":\"textDocument/hover\"}")));

		Assertions.assertTrue(toServer.getMessages().isEmpty(), "Failed requests are not forwarded");
		Assertions.assertEquals(0, pending.size(), "Failed requests are not recorded");
		Response error = (Response) toClient.getMessages().get(0);
		Assertions.assertEquals(MessageId.of(4), error.getId());
		Assertions.assertEquals(-32603, error.getError().getCode());
		Assertions.assertTrue(error.getError().getMessage().contains("bad position"), error.getError().getMessage());
		Assertions.assertTrue(error.getError().getMessage().contains(HOVER), error.getError().getMessage());
	}

	@Test
	void testRequestHookErrorAnswersClientAndKeepsForwarding() throws Exception {
		hooks.register("m", new Hook() {
			@Override
			public CompletableFuture<HookOutput<Request>> onRequest(Request request) {
				throw new AssertionError("boom");
			}
		});
		MessageRouter router = router();
		QueueMessageSource source = new QueueMessageSource()
				.offerRaw(JsonParser.parseString("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"m\"}"))
				.offer(Notification.of("textDocument/didSave", null))
				.end();

		Assertions.assertEquals(PumpExit.END_OF_STREAM, router.pumpClientToServer(source));

		Response error = (Response) toClient.getMessages().get(0);
		Assertions.assertEquals(MessageId.of(1), error.getId());
		Assertions.assertEquals(-32603, error.getError().getCode());
		Assertions.assertTrue(error.getError().getMessage().contains("boom"), error.getError().getMessage());
		List<Message> forwarded = toServer.getMessages();
		Assertions.assertEquals(1, forwarded.size(), "Only the notification reaches the server");
		Assertions.assertEquals("textDocument/didSave", ((Notification) forwarded.get(0)).getMethod());
		Assertions.assertEquals(0, pending.size());
	}

	@Test
	void testRecoveredAnomaliesAreLoggedWithTheirKind() throws Exception {
		MessageRouter router = router();
		Logger logger = (Logger) LoggerFactory.getLogger(MessageRouter.class);
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		logger.addAppender(appender);
		try {
			router.handleFromServer(Response.success(MessageId.of(99), new JsonPrimitive("late")));
			router.handleFromClient(new Request(MessageId.of(7), "textDocument/hover", null));
			router.handleFromClient(new Request(MessageId.of(7), "textDocument/definition", null));
		} finally {
			logger.detachAppender(appender);
			appender.stop();
		}

		List<String> warnings = new ArrayList<>();
		for (ILoggingEvent event : appender.list) {
			if (event.getLevel() == Level.WARN) {
				warnings.add(event.getFormattedMessage());
			}
		}
		Assertions.assertEquals(2, warnings.size(), warnings.toString());
		Assertions.assertTrue(warnings.get(0).startsWith("[" + ProxyErrorKind.UNMATCHED_RESPONSE + "]"),
				warnings.get(0));
		Assertions.assertTrue(warnings.get(1).startsWith("[" + ProxyErrorKind.DUPLICATE_IN_FLIGHT_ID + "]"),
				warnings.get(1));
		Assertions.assertEquals(1, toClient.getMessages().size(), "Unmatched response is still forwarded");
		Assertions.assertEquals(2, toServer.getMessages().size());
		Assertions.assertEquals(1, pending.size());
	}

	@Test
	void testNullIdRequestIsForwardedWithoutCorrelation() throws Exception {
		MessageRouter router = router();
		Message request = parse("{\"jsonrpc\":\"2.0\",\"id\":null,\"method\":\"foo\"}");

		Assertions.assertTrue(router.handleFromClient(request));

		Assertions.assertEquals(List.of(request), toServer.getMessages());
		Assertions.assertEquals(0, pending.size());
		Assertions.assertEquals(0, pending.getRecordedCount());
	}

	@Test
	void testResponseHookNotificationsFollowResponse() throws Exception {
		hooks.register(COMPLETION, new Hook() {
			@Override
			public CompletableFuture<HookOutput<Response>> onResponse(Response response) {
				return CompletableFuture.completedFuture(HookOutput.of(response)
						.withNotification(Notification.of("custom/first", null))
						.withNotification(Notification.of("custom/second", null)));
			}
		});
		MessageRouter router = router();
		router.handleFromClient(parse("{\"id\":8,\"method\":\"textDocument/completion\"}"));
		journal.clear();

		router.handleFromServer(parse("{\"id\":8,\"result\":[]}"));

		Assertions.assertEquals(3, journal.size());
		Assertions.assertTrue(journal.get(0).contains("\"id\":8"), journal.get(0));
		Assertions.assertTrue(journal.get(1).contains("custom/first"), journal.get(1));
		Assertions.assertTrue(journal.get(2).contains("custom/second"), journal.get(2));
	}

	// ------------------------------------------------------------------
	// Traffic that is never intercepted
	// ------------------------------------------------------------------

	@Test
	void testNotificationsBypassHooks() throws Exception {
		List<String> calls = new CopyOnWriteArrayList<>();
		hooks.register("textDocument/didOpen", new Hook() {
			@Override
			public CompletableFuture<HookOutput<Request>> onRequest(Request request) {
				calls.add("request");
				return Hook.super.onRequest(request);
			}
		});
		MessageRouter router = router();
		Message fromClient = parse("{\"method\":\"textDocument/didOpen\",\"params\":{}}");
		Message fromServer = parse("{\"method\":\"textDocument/publishDiagnostics\",\"params\":{}}");

		router.handleFromClient(fromClient);
		router.handleFromServer(fromServer);

		Assertions.assertTrue(calls.isEmpty());
		Assertions.assertEquals(List.of(fromClient), toServer.getMessages());
		Assertions.assertEquals(List.of(fromServer), toClient.getMessages());
		Assertions.assertEquals(0, pending.size());
	}

	@Test
	void testServerRequestsAndClientResponsesAreForwarded() throws Exception {
		List<String> calls = new CopyOnWriteArrayList<>();
		hooks.register("workspace/configuration", new Hook() {
			@Override
			public CompletableFuture<HookOutput<Request>> onRequest(Request request) {
				calls.add("request");
				return Hook.super.onRequest(request);
			}

			@Override
			public CompletableFuture<HookOutput<Response>> onResponse(Response response) {
				calls.add("response");
				return Hook.super.onResponse(response);
			}
		});
		MessageRouter router = router();
		Message serverRequest = parse("{\"id\":\"s1\",\"method\":\"workspace/configuration\",\"params\":{}}");
		Message clientResponse = parse("{\"id\":\"s1\",\"result\":[{}]}");

		router.handleFromServer(serverRequest);
		router.handleFromClient(clientResponse);

		Assertions.assertTrue(calls.isEmpty());
		Assertions.assertEquals(List.of(serverRequest), toClient.getMessages());
		Assertions.assertEquals(List.of(clientResponse), toServer.getMessages());
		Assertions.assertEquals(0, pending.size());
	}

	@Test
	void testNullIdErrorResponseIsForwarded() throws Exception {
		MessageRouter router = router();
		router.handleFromClient(parse("{\"id\":1,\"method\":\"m\"}"));
		Message response = parse("{\"id\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}");

		router.handleFromServer(response);

		Assertions.assertEquals(List.of(response), toClient.getMessages());
		Assertions.assertEquals(1, pending.size());
	}

	@Test
	void testDuplicateInFlightIdIsForwardedAndNewerWins() throws Exception {
		List<String> seen = new CopyOnWriteArrayList<>();
		hooks.register(HOVER, taggingResponseHook("hover", seen));
		hooks.register(COMPLETION, taggingResponseHook("completion", seen));
		MessageRouter router = router();

		router.handleFromClient(parse("{\"id\":6,\"method\":\"textDocument/hover\"}"));
		router.handleFromClient(parse("{\"id\":6,\"method\":\"textDocument/completion\"}"));
		router.handleFromServer(parse("{\"id\":6,\"result\":\"r\"}"));

		Assertions.assertEquals(2, toServer.getMessages().size(), "Both requests are forwarded");
		Assertions.assertEquals(List.of("completion:6"), seen);
		Assertions.assertEquals(1, pending.getReplacedCount());
	}

	// ------------------------------------------------------------------
	// Loops
	// ------------------------------------------------------------------

	@Test
	void testClosedDestinationEndsLoop() throws Exception {
		MessageRouter router = router();
		toServer.close();
		QueueMessageSource source = new QueueMessageSource()
				.offer(Notification.of("initialized", null))
				.offer(Notification.of("never-read", null));

		Assertions.assertEquals(PumpExit.DESTINATION_CLOSED, router.pumpClientToServer(source));
	}

	@Test
	void testEndOfStreamEndsLoop() throws Exception {
		MessageRouter router = router();
		QueueMessageSource source = new QueueMessageSource()
				.offer(Notification.of("window/logMessage", null))
				.end();

		Assertions.assertEquals(PumpExit.END_OF_STREAM, router.pumpServerToClient(source));
		Assertions.assertEquals(1, toClient.getMessages().size());
	}

	@Test
	void testMalformedInputEndsLoopWithException() {
		MessageRouter router = router();
		QueueMessageSource source = new QueueMessageSource()
				.offer(Notification.of("ok", null))
				.offerRaw(JsonParser.parseString("{\"id\":1}"))
				.offer(Notification.of("after", null));

		Assertions.assertThrows(MalformedMessageException.class, () -> router.pumpClientToServer(source));
		Assertions.assertEquals(1, toServer.getMessages().size());
	}

	@Test
	void testStopEndsLoop() throws Exception {
		MessageRouter router = router();
		QueueMessageSource source = new QueueMessageSource();
		Future<PumpExit> exit = executor.submit(() -> router.pumpClientToServer(source));

		router.stop();
		source.close();

		PumpExit result = exit.get(5, TimeUnit.SECONDS);
		Assertions.assertTrue(result == PumpExit.STOPPED || result == PumpExit.END_OF_STREAM, String.valueOf(result));
		Assertions.assertTrue(router.isStopped());
	}

	@Test
	void testSlowResponseHookDoesNotBlockClientDirection() throws Exception {
		CountDownLatch hookEntered = new CountDownLatch(1);
		CountDownLatch releaseHook = new CountDownLatch(1);
		hooks.register(HOVER, new Hook() {
			@Override
			public CompletableFuture<HookOutput<Response>> onResponse(Response response) {
				hookEntered.countDown();
				try {
					releaseHook.await(5, TimeUnit.SECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return Hook.super.onResponse(response);
			}
		});
		MessageRouter router = router();
		QueueMessageSource fromClient = new QueueMessageSource();
		QueueMessageSource fromServer = new QueueMessageSource();
		Future<PumpExit> c2s = executor.submit(() -> router.pumpClientToServer(fromClient));
		Future<PumpExit> s2c = executor.submit(() -> router.pumpServerToClient(fromServer));

		Request hover = new Request(MessageId.of(1), HOVER, null);
		fromClient.offer(hover);
		toServer.awaitMessages(1, 5000);
		fromServer.offer(responseFor(hover, "slow"));
		Assertions.assertTrue(hookEntered.await(5, TimeUnit.SECONDS));

		fromClient.offer(new Request(MessageId.of(2), COMPLETION, null));
		List<Message> forwarded = toServer.awaitMessages(2, 5000);
		Assertions.assertEquals(2, forwarded.size(), "Client direction keeps flowing while a response hook runs");
		Assertions.assertTrue(toClient.getMessages().isEmpty());

		releaseHook.countDown();
		Assertions.assertEquals(1, toClient.awaitMessages(1, 5000).size());

		fromClient.end();
		fromServer.end();
		Assertions.assertEquals(PumpExit.END_OF_STREAM, c2s.get(5, TimeUnit.SECONDS));
		Assertions.assertEquals(PumpExit.END_OF_STREAM, s2c.get(5, TimeUnit.SECONDS));
	}

	@Test
	void testHookFailureResponseMessage() {
		Request request = new Request(MessageId.of(1), HOVER, null);
		Response response = MessageRouter.hookFailureResponse(request,
				new HookException(HookPhase.REQUEST, HOVER, "boom"));

		Assertions.assertEquals("Proxy hook for 'textDocument/hover' failed: boom", response.getError().getMessage());
	}
}
