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
import java.util.Random;

import org.riprovare.RetryPolicy;

/**
 * Static factories for the built-in policies. Every call returns a new instance, which
 * must not be shared between executions running at the same time.
 *
 */
public final class RetryPolicies {

	private RetryPolicies() {
	}

	/**
	 * @param attempts the maximum number of invocations
	 * @return a policy retrying without pause
	 * @see SimpleRetryPolicy
	 */
	public static SimpleRetryPolicy simple(int attempts) {
		return new SimpleRetryPolicy(attempts);
	}

	/**
	 * @param attempts the maximum number of invocations
	 * @param delay the pause between attempts in milliseconds
	 * @return a policy pausing for a fixed period
	 * @see FixedBackOffRetryPolicy
	 */
	public static FixedBackOffRetryPolicy fixed(int attempts, long delay) {
		return new FixedBackOffRetryPolicy(attempts, delay);
	}

	/**
	 * @param attempts the maximum number of invocations
	 * @param initialDelay the first pause in milliseconds
	 * @return a policy pausing for an exponentially growing, jittered period
	 * @see ExponentialBackOffRetryPolicy
	 */
	public static ExponentialBackOffRetryPolicy exponentialBackoff(int attempts, long initialDelay) {
		return new ExponentialBackOffRetryPolicy(attempts, initialDelay);
	}

	public static ExponentialBackOffRetryPolicy exponentialBackoff(int attempts, long initialDelay, Random random) {
		return new ExponentialBackOffRetryPolicy(attempts, initialDelay, random);
	}

	/**
	 * Restrict a policy to failures of the given types.
	 * @param delegate the policy applied to retryable failures
	 * @param retryableTypes the failure types to retry
	 * @return a policy that stops on any other failure
	 * @see ExceptionTypeRetryPolicy
	 */
	@SafeVarargs
	public static ExceptionTypeRetryPolicy retryingOn(RetryPolicy delegate,
			Class<? extends Throwable>... retryableTypes) {
		return new ExceptionTypeRetryPolicy(delegate, Arrays.asList(retryableTypes));
	}

}
