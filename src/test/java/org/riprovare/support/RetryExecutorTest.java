/*
 * Copyright 2006-2020 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.riprovare.support;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Test;

import org.riprovare.ErrorHook;
import org.riprovare.ExhaustedRetryException;
import org.riprovare.RetryException;
import org.riprovare.RetryPolicy;
import org.riprovare.backoff.DummySleeper;
import org.riprovare.policy.ExponentialBackOffRetryPolicy;
import org.riprovare.policy.FixedBackOffRetryPolicy;
import org.riprovare.policy.RetryPolicies;
import org.riprovare.policy.SimpleRetryPolicy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RetryExecutorTest {

	private final AtomicInteger count = new AtomicInteger();

	private final AtomicInteger hookCount = new AtomicInteger();

	private final ErrorHook countingHook = throwable -> this.hookCount.incrementAndGet();

	@After
	public void clearInterrupt() {
		Thread.interrupted();
	}

	@Test
	public void testSuccessInvokesOnce() {
		for (RetryPolicy policy : allBuiltIns(3)) {
			this.count.set(0);
			String result = RetryExecutor.execute(policy, () -> {
				this.count.incrementAndGet();
				return "foo";
			}, RetryOptions.errorHook(this.countingHook));
			assertEquals("foo", result);
			assertEquals(1, this.count.get());
			assertEquals(0, this.hookCount.get());
		}
	}

	@Test
	public void testNullResultIsSuccess() {
		assertNull(RetryExecutor.execute(new SimpleRetryPolicy(3), () -> {
			this.count.incrementAndGet();
			return null;
		}));
		assertEquals(1, this.count.get());
	}

	@Test
	public void testAlwaysFailingExhaustsAttempts() {
		final IllegalStateException boom = new IllegalStateException("boom");
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(3), () -> {
				this.count.incrementAndGet();
				throw boom;
			}, RetryOptions.errorHook(this.countingHook));
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			assertSame(boom, ex.getCause());
			assertEquals(3, ex.getAttempts());
			assertEquals("max retries exceeded: boom; nested exception is java.lang.IllegalStateException: boom",
					ex.getMessage());
		}
		assertEquals(3, this.count.get());
		assertEquals(3, this.hookCount.get());
	}

	@Test
	public void testExhaustionIsRetryException() {
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(1), () -> {
				throw new IOException("io");
			});
			fail("Expected ExhaustedRetryException");
		}
		catch (RetryException ex) {
			assertTrue(ex instanceof ExhaustedRetryException);
			assertTrue(ex.getCause() instanceof IOException);
		}
	}

	@Test
	public void testRecoversOnThirdAttempt() {
		String result = RetryExecutor.execute(new SimpleRetryPolicy(3), () -> {
			if (this.count.incrementAndGet() < 3) {
				throw new IllegalStateException("oh snap this broke");
			}
			return "recovered";
		}, RetryOptions.errorHook(this.countingHook));
		assertEquals("recovered", result);
		assertEquals(3, this.count.get());
		assertEquals(2, this.hookCount.get());
	}

	@Test
	public void testInvocationCountsForAllBudgets() {
		for (int attempts = 1; attempts <= 8; attempts++) {
			for (int failures = 0; failures < attempts; failures++) {
				final int failuresBeforeSuccess = failures;
				final AtomicInteger invocations = new AtomicInteger();
				Integer result = RetryExecutor.execute(new SimpleRetryPolicy(attempts), () -> {
					if (invocations.incrementAndGet() <= failuresBeforeSuccess) {
						throw new IllegalStateException("fail");
					}
					return invocations.get();
				});
				assertEquals(failures + 1, result.intValue());
				assertEquals(failures + 1, invocations.get());
			}
			this.count.set(0);
			this.hookCount.set(0);
			try {
				RetryExecutor.execute(new SimpleRetryPolicy(attempts), () -> {
					this.count.incrementAndGet();
					throw new IllegalStateException("fail");
				}, RetryOptions.errorHook(this.countingHook));
				fail("Expected ExhaustedRetryException");
			}
			catch (ExhaustedRetryException ex) {
				assertEquals(attempts, ex.getAttempts());
			}
			assertEquals(attempts, this.count.get());
			assertEquals(attempts, this.hookCount.get());
		}
	}

	@Test
	public void testZeroAttemptsStillInvokesOnce() {
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(0), () -> {
				this.count.incrementAndGet();
				throw new IllegalStateException("fail");
			});
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			assertEquals(1, ex.getAttempts());
		}
		assertEquals(1, this.count.get());
	}

	@Test
	public void testFixedBackOffElapsedTime() {
		long start = System.nanoTime();
		try {
			RetryExecutor.execute(new FixedBackOffRetryPolicy(3, 50), () -> {
				this.count.incrementAndGet();
				throw new IllegalStateException("fail");
			});
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			long elapsedMillis = (System.nanoTime() - start) / 1000000;
			assertTrue("Elapsed " + elapsedMillis + "ms", elapsedMillis >= 99);
		}
		assertEquals(3, this.count.get());
	}

	@Test
	public void testNoBackOffBeforeFirstOrAfterLastAttempt() {
		final DummySleeper sleeper = new DummySleeper();
		FixedBackOffRetryPolicy policy = new FixedBackOffRetryPolicy(4, 10);
		policy.setSleeper(sleeper);
		try {
			RetryExecutor.execute(policy, () -> {
				// one pause per completed attempt, except the last one
				assertEquals(this.count.getAndIncrement(), sleeper.getBackOffs().size());
				throw new IllegalStateException("fail");
			});
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			assertEquals(3, sleeper.getBackOffs().size());
		}
		assertEquals(4, this.count.get());
	}

	@Test
	public void testCancellationStopsImmediately() {
		for (RetryPolicy policy : allBuiltIns(5)) {
			this.count.set(0);
			try {
				RetryExecutor.execute(policy, () -> {
					this.count.incrementAndGet();
					throw new CancellationException("caller gave up");
				});
				fail("Expected ExhaustedRetryException");
			}
			catch (ExhaustedRetryException ex) {
				assertTrue(ex.getCause() instanceof CancellationException);
			}
			assertEquals(1, this.count.get());
		}
	}

	@Test
	public void testInterruptedOperationRestoresInterruptFlag() {
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(5), () -> {
				this.count.incrementAndGet();
				throw new InterruptedException();
			});
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			assertTrue(ex.getCause() instanceof InterruptedException);
		}
		assertEquals(1, this.count.get());
		assertTrue(Thread.currentThread().isInterrupted());
	}

	@Test
	public void testCustomPolicyInspectsFailure() {
		RetryPolicy transientOnly = lastThrowable -> lastThrowable instanceof IOException && this.count.get() < 5;
		try {
			RetryExecutor.execute(transientOnly, () -> {
				if (this.count.incrementAndGet() < 3) {
					throw new IOException("network");
				}
				throw new IllegalArgumentException("validation");
			});
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			assertTrue(ex.getCause() instanceof IllegalArgumentException);
		}
		assertEquals(3, this.count.get());
	}

	@Test
	public void testRetryingOnFactory() {
		try {
			RetryExecutor.execute(RetryPolicies.retryingOn(new SimpleRetryPolicy(10), IOException.class), () -> {
				this.count.incrementAndGet();
				throw new IllegalArgumentException("validation");
			});
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			assertEquals(1, ex.getAttempts());
		}
	}

	@Test
	public void testFailingHookDoesNotAbortRetries() {
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(3), () -> {
				this.count.incrementAndGet();
				throw new IllegalStateException("boom");
			}, RetryOptions.errorHook(throwable -> {
				this.hookCount.incrementAndGet();
				throw new IllegalStateException("hook failure");
			}));
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			assertEquals("boom", ex.getCause().getMessage());
		}
		assertEquals(3, this.count.get());
		assertEquals(3, this.hookCount.get());
	}

	@Test
	public void testErrorFromHookIsNotSwallowed() {
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(3), () -> {
				this.count.incrementAndGet();
				throw new IllegalStateException("boom");
			}, RetryOptions.errorHook(throwable -> {
				throw new FatalError();
			}));
			fail("Expected FatalError");
		}
		catch (FatalError ex) {
			// expected
		}
		assertEquals(1, this.count.get());
	}

	@Test
	public void testHookSeesFailureBeforePolicy() {
		final List<String> events = new ArrayList<String>();
		RetryPolicy policy = lastThrowable -> {
			events.add("policy:" + lastThrowable.getMessage());
			return events.size() < 4;
		};
		try {
			RetryExecutor.execute(policy, () -> {
				events.add("attempt");
				throw new IllegalStateException("x");
			}, RetryOptions.errorHook(throwable -> events.add("hook:" + throwable.getMessage())));
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			// expected
		}
		assertEquals("attempt", events.get(0));
		assertEquals("hook:x", events.get(1));
		assertEquals("policy:x", events.get(2));
		assertEquals("attempt", events.get(3));
	}

	@Test
	public void testLaterOptionOverridesEarlierOne() {
		final AtomicInteger first = new AtomicInteger();
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(2), () -> {
				throw new IllegalStateException("fail");
			}, RetryOptions.errorHook(throwable -> first.incrementAndGet()), RetryOptions.name("override"),
					RetryOptions.errorHook(this.countingHook));
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			// expected
		}
		assertEquals(0, first.get());
		assertEquals(2, this.hookCount.get());
	}

	@Test
	public void testCustomOption() {
		RetryOption custom = settings -> settings.setErrorHook(this.countingHook);
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(2), () -> {
				throw new IllegalStateException("fail");
			}, custom);
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			// expected
		}
		assertEquals(2, this.hookCount.get());
	}

	@Test
	public void testErrorIsNotRetried() {
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(5), () -> {
				this.count.incrementAndGet();
				throw new FatalError();
			}, RetryOptions.errorHook(this.countingHook));
			fail("Expected FatalError");
		}
		catch (FatalError ex) {
			// expected
		}
		assertEquals(1, this.count.get());
		assertEquals(0, this.hookCount.get());
	}

	@Test
	public void testNullPolicyFailsWithoutInvocation() {
		try {
			RetryExecutor.execute(null, () -> this.count.incrementAndGet());
			fail("Expected IllegalArgumentException");
		}
		catch (IllegalArgumentException ex) {
			assertTrue(ex.getMessage().contains("RetryPolicy"));
		}
		assertEquals(0, this.count.get());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullCallbackFails() {
		RetryExecutor.execute(new SimpleRetryPolicy(3), null);
	}

	@Test
	public void testNullOptionFailsWithoutInvocation() {
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(3), () -> this.count.incrementAndGet(),
					RetryOptions.name("ok"), null);
			fail("Expected IllegalArgumentException");
		}
		catch (IllegalArgumentException ex) {
			// expected
		}
		assertEquals(0, this.count.get());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullHookOptionFails() {
		RetryOptions.errorHook(null);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyNameOptionFails() {
		RetryOptions.name("");
	}

	@Test
	public void testLargeAttemptCountUsesBoundedStack() {
		final int attempts = 200000;
		try {
			RetryExecutor.execute(new SimpleRetryPolicy(attempts), () -> {
				this.count.incrementAndGet();
				throw new IllegalStateException("fail");
			});
			fail("Expected ExhaustedRetryException");
		}
		catch (ExhaustedRetryException ex) {
			assertEquals(attempts, ex.getAttempts());
		}
		assertEquals(attempts, this.count.get());
	}

	@Test
	public void testConcurrentExecutionsWithOwnPolicies() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			List<Future<Integer>> futures = new ArrayList<Future<Integer>>();
			for (int i = 0; i < 32; i++) {
				futures.add(executor.submit(() -> {
					final AtomicInteger invocations = new AtomicInteger();
					try {
						RetryExecutor.execute(new SimpleRetryPolicy(5), () -> {
							invocations.incrementAndGet();
							Thread.yield();
							throw new IllegalStateException("fail");
						});
					}
					catch (ExhaustedRetryException ex) {
						// expected
					}
					return invocations.get();
				}));
			}
			for (Future<Integer> future : futures) {
				assertEquals(5, future.get(30, TimeUnit.SECONDS).intValue());
			}
		}
		finally {
			executor.shutdownNow();
		}
	}

	private static List<RetryPolicy> allBuiltIns(int attempts) {
		List<RetryPolicy> policies = new ArrayList<RetryPolicy>();
		policies.add(new SimpleRetryPolicy(attempts));
		FixedBackOffRetryPolicy fixed = new FixedBackOffRetryPolicy(attempts, 1000);
		fixed.setSleeper(new DummySleeper());
		policies.add(fixed);
		ExponentialBackOffRetryPolicy exponential = new ExponentialBackOffRetryPolicy(attempts, 1000);
		exponential.setSleeper(new DummySleeper());
		policies.add(exponential);
		return policies;
	}

	@SuppressWarnings("serial")
	private static class FatalError extends Error {

	}

}
