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

import java.util.Arrays;

import org.riprovare.RetryPolicy;
import org.springframework.util.Assert;

/**
 * A {@link RetryPolicy} that composes a list of other policies and delegates calls to
 * them in order.
 * <p>
 * Every delegate is consulted on every failure, whatever the answer of the previous
 * ones, so that their attempt counters advance together. Delegates that pause do so in
 * turn, hence combining more than one sleeping policy adds up their pauses.
 *
 * 组合重试机制
 */
public class CompositeRetryPolicy implements RetryPolicy {

	private final RetryPolicy[] policies;

	private boolean optimistic = false;

	public CompositeRetryPolicy(RetryPolicy... policies) {
		Assert.notEmpty(policies, "At least one policy is required");
		Assert.noNullElements(policies, "Policies must not contain null elements");
		this.policies = Arrays.copyOf(policies, policies.length);
	}

	/**
	 * Setter for optimistic.
	 * @param optimistic should this retry policy be optimistic
	 */
	public void setOptimistic(boolean optimistic) {
		this.optimistic = optimistic;
	}

	/**
	 * Delegate to the policies. A pessimistic composite (the default) retries only if
	 * all of them can retry, an optimistic one retries if any of them can.
	 * @param lastThrowable the failure of the last attempt
	 */
	@Override
	public boolean canRetry(Throwable lastThrowable) {
		// 乐观的重试: 只要有一个允许重试就重试
		if (this.optimistic) {
			boolean retryable = false;
			for (RetryPolicy policy : this.policies) {
				if (policy.canRetry(lastThrowable)) {
					retryable = true;
				}
			}
			return retryable;
		}
		// 非乐观的重试: 只要有一个不允许重试就不重试
		boolean retryable = true;
		for (RetryPolicy policy : this.policies) {
			if (!policy.canRetry(lastThrowable)) {
				retryable = false;
			}
		}
		return retryable;
	}

}
