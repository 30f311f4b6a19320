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

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomaszrup.lspproxy.ProxyErrorKind;
import com.tomaszrup.lspproxy.ProxyException;
import com.tomaszrup.lspproxy.ProxyOptions;

/**
 * Tests for {@link ProcessSupervisor} and {@link ServerProcess}. The tests
 * that start real processes need a POSIX shell and are skipped elsewhere.
 */
class ProcessSupervisorTests {

	private final ProcessSupervisor supervisor = new ProcessSupervisor();

	private static void assumePosix() {
		Assumptions.assumeTrue(Files.isExecutable(Paths.get("/bin/sh")), "requires /bin/sh");
		Assumptions.assumeTrue(Files.isExecutable(Paths.get("/bin/cat")), "requires /bin/cat");
	}

	private static String readAll(InputStream input) throws Exception {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		input.transferTo(buffer);
		return buffer.toString(StandardCharsets.UTF_8);
	}

	@Test
	void testMissingCommandIsSpawnFailure() {
		ProxyException e = Assertions.assertThrows(ProxyException.class,
				() -> supervisor.spawn("/nonexistent/lsp-server-for-tests", List.of(), ProxyOptions.defaults()));

		Assertions.assertEquals(ProxyErrorKind.PROCESS_SPAWN_FAILURE, e.getKind());
	}

	@Test
	void testBlankCommandIsSpawnFailure() {
		ProxyException e = Assertions.assertThrows(ProxyException.class,
				() -> supervisor.spawn(" ", null, ProxyOptions.defaults()));

		Assertions.assertEquals(ProxyErrorKind.PROCESS_SPAWN_FAILURE, e.getKind());
	}

	@Test
	void testStreamsAreWiredToTheChild() throws Exception {
		assumePosix();
		ServerProcess process = supervisor.spawn("/bin/cat", List.of(), ProxyOptions.defaults());
		try {
			try (OutputStream stdin = process.getInput()) {
				stdin.write("ping".getBytes(StandardCharsets.UTF_8));
			}

			Assertions.assertEquals("ping", readAll(process.getOutput()));
			Assertions.assertEquals(Integer.valueOf(0), process.onExit().get(5, TimeUnit.SECONDS));
			Assertions.assertEquals(List.of("/bin/cat"), process.getCommandLine());
		} finally {
			process.stop(Duration.ofSeconds(1));
		}
	}

	@Test
	void testEnvironmentAndWorkingDirectoryArePassed(@TempDir Path tempDir) throws Exception {
		assumePosix();
		ProxyOptions options = ProxyOptions.builder()
				.workingDirectory(tempDir)
				.environment("LSPPROXY_TEST_VALUE", "from-options")
				.build();

		ServerProcess process = supervisor.spawn("/bin/sh",
				List.of("-c", "printf '%s|%s' \"$LSPPROXY_TEST_VALUE\" \"$(pwd -P)\""), options);
		try {
			String output = readAll(process.getOutput());
			Assertions.assertEquals("from-options|" + tempDir.toRealPath(), output);
		} finally {
			process.stop(Duration.ofSeconds(1));
		}
	}

	@Test
	void testStopClosesStdinAndReturnsExitCode() throws Exception {
		assumePosix();
		ServerProcess process = supervisor.spawn("/bin/cat", List.of(), ProxyOptions.defaults());

		Integer exitCode = process.stop(Duration.ofSeconds(5));

		Assertions.assertEquals(Integer.valueOf(0), exitCode);
		Assertions.assertFalse(process.isAlive());
	}

	@Test
	void testStopTerminatesServerIgnoringStdin() throws Exception {
		assumePosix();
		ServerProcess process = supervisor.spawn("/bin/sh", List.of("-c", "exec sleep 30"), ProxyOptions.defaults());

		Integer exitCode = process.stop(Duration.ofMillis(200));

		Assertions.assertNotNull(exitCode);
		Assertions.assertNotEquals(Integer.valueOf(0), exitCode);
		Assertions.assertFalse(process.isAlive());
	}

	@Test
	void testStderrDoesNotBlockTheServer() throws Exception {
		assumePosix();
		ServerProcess process = supervisor.spawn("/bin/sh",
				List.of("-c", "i=0; while [ $i -lt 2000 ]; do echo \"diagnostic line $i\" >&2; i=$((i+1)); done"),
				ProxyOptions.defaults());

		Assertions.assertEquals(Integer.valueOf(0), process.onExit().get(10, TimeUnit.SECONDS));
		process.stop(Duration.ofSeconds(1));
	}
}
