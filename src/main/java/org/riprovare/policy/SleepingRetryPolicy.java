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

import org.riprovare.backoff.Sleeper;
import org.riprovare.backoff.ThreadWaitSleeper;
import org.springframework.util.Assert;

/**
 * An {@link AttemptCountingRetryPolicy} that pauses between attempts through a
 * {@link Sleeper}. An interrupted pause is treated as a cancellation: the interrupt
 * status of the thread is restored and the policy stops retrying.
 *
 */
public abstract class SleepingRetryPolicy extends AttemptCountingRetryPolicy {

	private Sleeper sleeper = new ThreadWaitSleeper();

	protected SleepingRetryPolicy(int maxAttempts) {
		super(maxAttempts);
	}

	/**
	 * Public setter for the {@link Sleeper} strategy.
	 * @param sleeper the sleeper to set defaults to {@link ThreadWaitSleeper}.
	 */
	public void setSleeper(Sleeper sleeper) {
		Assert.notNull(sleeper, "Sleeper must not be null");
		this.sleeper = sleeper;
	}

	/**
	 * Pause for the given period. A period of zero or less returns straight away.
	 * @param backOffPeriod the pause in milliseconds
	 * @return false if the pause was interrupted
	 */
	protected boolean sleep(long backOffPeriod) {
		if (backOffPeriod <= 0) {
			return true;
		}
		try {
			if (this.logger.isTraceEnabled()) {
				this.logger.trace("Sleeping for " + backOffPeriod + "ms");
			}
			this.sleeper.sleep(backOffPeriod);
			return true;
		}
		catch (InterruptedException e) {
			// 恢复中断标记，放弃剩余的重试
			Thread.currentThread().interrupt();
			if (this.logger.isDebugEnabled()) {
				this.logger.debug("Back off interrupted, abandoning remaining attempts");
			}
			return false;
		}
	}

}
