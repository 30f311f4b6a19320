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
package com.tomaszrup.lspproxy.hook;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspproxy.message.HookOutput;
import com.tomaszrup.lspproxy.message.Message;
import com.tomaszrup.lspproxy.message.Request;
import com.tomaszrup.lspproxy.message.Response;

/**
 * Runs hooks on behalf of the router and turns every way a hook can go wrong
 * (throwing, failing its future, returning {@code null}, answering with the
 * wrong message shape or id) into a {@link HookException}.
 *
 * <p>The calling thread waits for the hook's future. {@link VirtualMachineError}s
 * are rethrown rather than reported as hook failures.</p>
 */
public class HookInvoker {
	private static final Logger logger = LoggerFactory.getLogger(HookInvoker.class);

	public HookOutput<Request> invokeRequestHook(Hook hook, Request request) throws HookException {
		String method = request.getMethod();
		HookOutput<Request> output = await(HookPhase.REQUEST, method, () -> hook.onRequest(request));
		Message message = output.getMessage();
		if (!(message instanceof Request)) {
			throw new HookException(HookPhase.REQUEST, method,
					"Request hook returned " + describe(message) + " instead of a request");
		}
		return output;
	}

	/**
	 * @param method the method of the request this response answers
	 */
	public HookOutput<Response> invokeResponseHook(Hook hook, String method, Response response)
			throws HookException {
		HookOutput<Response> output = await(HookPhase.RESPONSE, method, () -> hook.onResponse(response));
		Message message = output.getMessage();
		if (!(message instanceof Response)) {
			throw new HookException(HookPhase.RESPONSE, method,
					"Response hook returned " + describe(message) + " instead of a response");
		}
		if (!((Response) message).getId().equals(response.getId())) {
			throw new HookException(HookPhase.RESPONSE, method, "Response hook changed the id from "
					+ response.getId() + " to " + ((Response) message).getId());
		}
		return output;
	}

	private <M extends Message> HookOutput<M> await(HookPhase phase, String method,
			Supplier<CompletableFuture<HookOutput<M>>> hookCall) throws HookException {
		HookOutput<M> output;
		try {
			CompletableFuture<HookOutput<M>> future = hookCall.get();
			if (future == null) {
				throw new HookException(phase, method, "Hook returned no future");
			}
			output = future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new HookException(phase, method, "Interrupted while waiting for hook", e);
		} catch (ExecutionException | RuntimeException | Error throwable) {
			Throwable root = unwrap(throwable);
			if (root instanceof VirtualMachineError) {
				throw (VirtualMachineError) root;
			}
			if (root instanceof HookException) {
				throw (HookException) root;
			}
			logger.debug("{} hook for {} failed", phase, method, root);
			throw new HookException(phase, method, summarizeThrowable(root), root);
		}
		if (output == null || output.getMessage() == null) {
			throw new HookException(phase, method, "Hook returned no message");
		}
		return output;
	}

	static String summarizeThrowable(Throwable throwable) {
		if (throwable == null) {
			return "<null>";
		}
		String message = throwable.getMessage();
		if (message == null || message.isBlank()) {
			return throwable.getClass().getName();
		}
		return throwable.getClass().getName() + ": " + message;
	}

	static Throwable unwrap(Throwable throwable) {
		Throwable current = throwable;
		while (current instanceof CompletionException || current instanceof ExecutionException) {
			Throwable cause = current.getCause();
			if (cause == null) {
				break;
			}
			current = cause;
		}
		return current;
	}

	private static String describe(Message message) {
		return message == null ? "null" : "a " + message.getKind().name().toLowerCase();
	}
}
