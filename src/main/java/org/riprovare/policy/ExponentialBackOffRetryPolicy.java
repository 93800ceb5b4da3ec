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

package org.riprovare.policy;

import java.util.Random;

import org.springframework.util.Assert;

/**
 * Retry policy that pauses for an exponentially growing, randomised period between
 * attempts.
 * <p>
 * The first pause is the initial delay. After every pause the delay becomes
 * {@code 2 * delay * jitter} where {@code jitter} is drawn uniformly from
 * {@code [0.25, 1.25)}, so delays grow on average without many concurrent callers
 * retrying in lock-step. The delay never exceeds {@link #setMaxDelay(long) maxDelay}.
 * <p>
 * The running delay is kept as a fraction of milliseconds and only rounded up when
 * handed to the {@link org.riprovare.backoff.Sleeper}, so a small delay shrunk by the
 * jitter never collapses to a zero pause.
 * <p>
 * The {@link Random} is injectable so that the jitter is reproducible under test.
 *
 * 指数退避重试机制
 */
public class ExponentialBackOffRetryPolicy extends SleepingRetryPolicy {

	public static final double MULTIPLIER = 2.0;

	public static final double MIN_JITTER = 0.25;

	private final long initialDelay;

	private final Random random;

	private long maxDelay = Long.MAX_VALUE;

	/**
	 * 当前间隔时间，保留小数部分
	 */
	private double currentDelay;

	public ExponentialBackOffRetryPolicy(int maxAttempts, long initialDelay) {
		this(maxAttempts, initialDelay, new Random());
	}

	/**
	 * @param maxAttempts the maximum number of invocations
	 * @param initialDelay the first pause in milliseconds, not negative
	 * @param random the source of the jitter
	 */
	public ExponentialBackOffRetryPolicy(int maxAttempts, long initialDelay, Random random) {
		super(maxAttempts);
		Assert.isTrue(initialDelay >= 0, "Initial delay must not be negative");
		Assert.notNull(random, "Random must not be null");
		this.initialDelay = initialDelay;
		this.random = random;
		this.currentDelay = initialDelay;
	}

	/**
	 * Upper bound for any single pause. Defaults to {@link Long#MAX_VALUE}.
	 * @param maxDelay the cap in milliseconds, not negative
	 */
	public void setMaxDelay(long maxDelay) {
		Assert.isTrue(maxDelay >= 0, "Max delay must not be negative");
		this.maxDelay = maxDelay;
		this.currentDelay = Math.min(this.currentDelay, (double) maxDelay);
	}

	public long getInitialDelay() {
		return this.initialDelay;
	}

	public long getMaxDelay() {
		return this.maxDelay;
	}

	/**
	 * @return the pause that the next back off will apply
	 */
	public long getCurrentDelay() {
		return toMillis(this.currentDelay);
	}

	@Override
	protected boolean backOff() {
		boolean proceed = sleep(toMillis(this.currentDelay));
		this.currentDelay = nextDelay(this.currentDelay);
		return proceed;
	}

	/**
	 * Compute the delay following the given one.
	 * @param delay the delay just applied
	 * @return the doubled, jittered delay, capped at the max delay
	 */
	protected double nextDelay(double delay) {
		double jitter = this.random.nextDouble() + MIN_JITTER;
		return Math.min(MULTIPLIER * delay * jitter, (double) this.maxDelay);
	}

	private static long toMillis(double delay) {
		// double 转 long 会在溢出时饱和为 Long.MAX_VALUE
		return (long) Math.ceil(delay);
	}

	@Override
	public void reset() {
		super.reset();
		this.currentDelay = Math.min(this.initialDelay, this.maxDelay);
	}

}
