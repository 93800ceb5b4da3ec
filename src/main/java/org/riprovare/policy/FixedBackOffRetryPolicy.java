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

import org.springframework.util.Assert;

/**
 * Retry policy that allows a fixed number of attempts and pauses for a fixed period
 * between two attempts.
 *
 * 固定间隔重试机制
 */
public class FixedBackOffRetryPolicy extends SleepingRetryPolicy {

	/**
	 * 间隔时间(毫秒)
	 */
	private final long backOffPeriod;

	/**
	 * @param maxAttempts the maximum number of invocations
	 * @param backOffPeriod the pause between attempts in milliseconds, not negative
	 */
	public FixedBackOffRetryPolicy(int maxAttempts, long backOffPeriod) {
		super(maxAttempts);
		Assert.isTrue(backOffPeriod >= 0, "Back off period must not be negative");
		this.backOffPeriod = backOffPeriod;
	}

	public long getBackOffPeriod() {
		return this.backOffPeriod;
	}

	@Override
	protected boolean backOff() {
		return sleep(this.backOffPeriod);
	}

}
