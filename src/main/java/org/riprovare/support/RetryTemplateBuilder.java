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

import java.util.function.Supplier;

import org.riprovare.ErrorHook;
import org.riprovare.RetryPolicy;
import org.riprovare.backoff.Sleeper;
import org.riprovare.policy.ExponentialBackOffRetryPolicy;
import org.riprovare.policy.FixedBackOffRetryPolicy;
import org.riprovare.policy.SimpleRetryPolicy;
import org.riprovare.policy.SleepingRetryPolicy;
import org.springframework.util.Assert;

/**
 * Fluent {@link RetryTemplate} configuration. Usage examples:
 *
 * <pre>{@code
 * RetryTemplate.builder()
 *      .maxAttempts(10)
 *      .exponentialBackoff(100)
 *      .maxDelay(10000)
 *      .errorHook(e -> log.warn("attempt failed", e))
 *      .build();
 *
 * RetryTemplate.builder()
 *      .customPolicy(() -> RetryPolicies.retryingOn(new SimpleRetryPolicy(5), IOException.class))
 *      .build();
 * }</pre>
 * Without any configuration the template attempts three times without pause. Choosing a
 * custom policy excludes the attempt and back off settings; fixed and exponential back
 * off exclude each other.
 *
 */
public class RetryTemplateBuilder {

	private int maxAttempts = SimpleRetryPolicy.DEFAULT_MAX_ATTEMPTS;

	private boolean maxAttemptsSet;

	private Long fixedBackOffPeriod;

	private Long initialDelay;

	private Long maxDelay;

	private Sleeper sleeper;

	private Supplier<? extends RetryPolicy> customPolicy;

	private ErrorHook errorHook;

	private String name;

	/**
	 * @param maxAttempts the maximum number of invocations, positive
	 * @return this
	 */
	public RetryTemplateBuilder maxAttempts(int maxAttempts) {
		Assert.isTrue(maxAttempts > 0, "Number of attempts should be positive");
		Assert.isNull(this.customPolicy, "You have already selected a custom policy");
		this.maxAttempts = maxAttempts;
		this.maxAttemptsSet = true;
		return this;
	}

	/**
	 * @param backOffPeriod the pause between attempts in milliseconds
	 * @return this
	 * @see FixedBackOffRetryPolicy
	 */
	public RetryTemplateBuilder fixedBackoff(long backOffPeriod) {
		Assert.isTrue(backOffPeriod >= 0, "Back off period must not be negative");
		Assert.isNull(this.initialDelay, "You have already selected exponential backoff");
		Assert.isNull(this.customPolicy, "You have already selected a custom policy");
		this.fixedBackOffPeriod = backOffPeriod;
		return this;
	}

	/**
	 * @param initialDelay the first pause in milliseconds
	 * @return this
	 * @see ExponentialBackOffRetryPolicy
	 */
	public RetryTemplateBuilder exponentialBackoff(long initialDelay) {
		Assert.isTrue(initialDelay >= 0, "Initial delay must not be negative");
		Assert.isNull(this.fixedBackOffPeriod, "You have already selected fixed backoff");
		Assert.isNull(this.customPolicy, "You have already selected a custom policy");
		this.initialDelay = initialDelay;
		return this;
	}

	/**
	 * Only valid together with {@link #exponentialBackoff(long)}.
	 * @param maxDelay the cap of a single pause in milliseconds
	 * @return this
	 */
	public RetryTemplateBuilder maxDelay(long maxDelay) {
		Assert.isTrue(maxDelay >= 0, "Max delay must not be negative");
		this.maxDelay = maxDelay;
		return this;
	}

	/**
	 * @param sleeper the {@link Sleeper} used by back off policies
	 * @return this
	 */
	public RetryTemplateBuilder sleeper(Sleeper sleeper) {
		Assert.notNull(sleeper, "Sleeper must not be null");
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * @param policyFactory returns a new policy on every call
	 * @return this
	 */
	public RetryTemplateBuilder customPolicy(Supplier<? extends RetryPolicy> policyFactory) {
		Assert.notNull(policyFactory, "Policy factory must not be null");
		Assert.isTrue(!this.maxAttemptsSet, "You have already selected max attempts");
		Assert.isTrue(this.fixedBackOffPeriod == null && this.initialDelay == null,
				"You have already selected a backoff");
		this.customPolicy = policyFactory;
		return this;
	}

	public RetryTemplateBuilder errorHook(ErrorHook errorHook) {
		Assert.notNull(errorHook, "ErrorHook must not be null");
		this.errorHook = errorHook;
		return this;
	}

	public RetryTemplateBuilder name(String name) {
		Assert.hasText(name, "Name must not be empty");
		this.name = name;
		return this;
	}

	/**
	 * @return a new {@link RetryTemplate}
	 */
	public RetryTemplate build() {
		Assert.state(this.maxDelay == null || this.initialDelay != null,
				"Max delay is only supported with exponential backoff");
		Assert.state(this.sleeper == null || this.customPolicy == null,
				"Sleeper is not applied to a custom policy, configure it on the policy instead");

		RetryTemplate retryTemplate = new RetryTemplate();
		retryTemplate.setRetryPolicyFactory(
				this.customPolicy != null ? this.customPolicy : createPolicyFactory());
		retryTemplate.setErrorHook(this.errorHook);
		retryTemplate.setName(this.name);
		return retryTemplate;
	}

	private Supplier<RetryPolicy> createPolicyFactory() {
		// 先拷贝配置，之后对builder的修改不影响已创建的模板
		final int maxAttempts = this.maxAttempts;
		final Long fixedBackOffPeriod = this.fixedBackOffPeriod;
		final Long initialDelay = this.initialDelay;
		final Long maxDelay = this.maxDelay;
		final Sleeper sleeper = this.sleeper;
		return () -> {
			SleepingRetryPolicy policy;
			if (initialDelay != null) {
				ExponentialBackOffRetryPolicy exponential = new ExponentialBackOffRetryPolicy(maxAttempts,
						initialDelay);
				if (maxDelay != null) {
					exponential.setMaxDelay(maxDelay);
				}
				policy = exponential;
			}
			else if (fixedBackOffPeriod != null) {
				policy = new FixedBackOffRetryPolicy(maxAttempts, fixedBackOffPeriod);
			}
			else {
				return new SimpleRetryPolicy(maxAttempts);
			}
			if (sleeper != null) {
				policy.setSleeper(sleeper);
			}
			return policy;
		};
	}

}
