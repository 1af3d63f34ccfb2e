package com.joshlong.mediaops.utils;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

class ProcessUtilsTest {

	private static long runningSleeps() {
		return ProcessHandle.current()
			.children()
			.filter(ProcessHandle::isAlive)
			.filter(p -> p.info().command().map(c -> c.endsWith("sleep")).orElse(false))
			.count();
	}

	private static boolean waitFor(long expectedSleeps) throws InterruptedException {
		var deadline = System.currentTimeMillis() + 5_000;
		while (runningSleeps() != expectedSleeps && System.currentTimeMillis() < deadline)
			Thread.sleep(25);
		return runningSleeps() == expectedSleeps;
	}

	@Test
	void output() throws Exception {
		var result = ProcessUtils.runCommand("sh", "-c", "echo hello");
		Assertions.assertTrue(result.succeeded());
		Assertions.assertEquals("hello", result.stdoutAsString().trim());
	}

	@Test
	void aFailingCommandReportsItsExitCodeAndStderr() {
		var ex = Assertions.assertThrows(ProcessUtils.ProcessFailedException.class,
				() -> ProcessUtils.runCommand("sh", "-c", "echo broken 1>&2; exit 3"));
		Assertions.assertEquals(3, ex.exitCode());
		Assertions.assertTrue(ex.getMessage().contains("broken"), ex.getMessage());
	}

	@Test
	void anInterruptedRunKillsItsProcess() throws Exception {
		var failure = new AtomicReference<Throwable>();
		var runner = new Thread(() -> {
			try {
				ProcessUtils.runCommand("sleep", "30");
			} //
			catch (Throwable e) {
				failure.set(e);
			}
		});
		runner.start();
		Assertions.assertTrue(waitFor(1), "the process never started");
		var interruptedAt = System.currentTimeMillis();
		runner.interrupt();
		runner.join(5_000);
		Assertions.assertFalse(runner.isAlive());
		Assertions.assertTrue(System.currentTimeMillis() - interruptedAt < 5_000);
		Assertions.assertInstanceOf(InterruptedException.class, failure.get());
		Assertions.assertTrue(waitFor(0), "the process outlived the interrupted run");
	}

}
