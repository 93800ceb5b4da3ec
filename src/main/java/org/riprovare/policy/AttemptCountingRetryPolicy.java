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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.riprovare.RetryPolicy;

/**
 * Base class for policies that allow a fixed number of attempts. Each call to
 * {@link #canRetry(Throwable)} consumes one attempt; the policy answers {@code true}
 * while attempts remain after that, having first applied its {@link #backOff() back off}.
 * <p>
 * A cancellation (see {@link Cancellations}) stops the retries immediately, without
 * consuming an attempt or backing off.
 * <p>
 * Instances are stateful and not thread-safe: use one instance per execution, or
 * {@link #reset()} it between two executions that do not overlap.
 *
 * 基于次数的重试机制
 */
public abstract class AttemptCountingRetryPolicy implements RetryPolicy {

	protected final Log logger = LogFactory.getLog(getClass());

	private final int maxAttempts;

	/**
	 * 剩余次数，不会小于零
	 */
	private int remainingAttempts;

	/**
	 * @param maxAttempts the maximum number of invocations of the operation, including
	 * the first one. Zero or less means no retry at all.
	 */
	protected AttemptCountingRetryPolicy(int maxAttempts) {
		this.maxAttempts = maxAttempts;
		this.remainingAttempts = Math.max(maxAttempts, 0);
	}

	@Override
	public boolean canRetry(Throwable lastThrowable) {
		if (Cancellations.isCancellation(lastThrowable)) {
			if (this.logger.isDebugEnabled()) {
				this.logger.debug("Operation cancelled, no further attempts: " + lastThrowable);
			}
			return false;
		}
		if (this.remainingAttempts > 0) {
			this.remainingAttempts--;
		}
		if (this.remainingAttempts > 0) {
			return backOff();
		}
		return false;
	}

	/**
	 * Applied before answering {@code true}. Implementations that pause do it here.
	 * @return true to go on with the next attempt, false to give up (e.g. the pause was
	 * interrupted)
	 */
	protected abstract boolean backOff();

	/**
	 * Restore the initial state so the instance can drive another execution.
	 */
	public void reset() {
		this.remainingAttempts = Math.max(this.maxAttempts, 0);
	}

	/**
	 * @return the number of attempts this policy was configured with
	 */
	public int getMaxAttempts() {
		return this.maxAttempts;
	}

	/**
	 * @return the number of attempts not consumed yet, never negative
	 */
	public int getRemainingAttempts() {
		return this.remainingAttempts;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[maxAttempts=" + this.maxAttempts + ", remainingAttempts="
				+ this.remainingAttempts + "]";
	}

}
