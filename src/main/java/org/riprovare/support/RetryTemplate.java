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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.riprovare.ErrorHook;
import org.riprovare.ExhaustedRetryException;
import org.riprovare.RetryCallback;
import org.riprovare.RetryOperations;
import org.riprovare.RetryPolicy;
import org.riprovare.policy.SimpleRetryPolicy;
import org.springframework.util.Assert;

/**
 * Template class that simplifies the execution of operations with retry semantics.
 * <p>
 * Retryable operations are encapsulated in implementations of the {@link RetryCallback}
 * interface and are executed through {@link RetryExecutor}. Since policies are stateful,
 * the template holds a factory and asks it for a fresh {@link RetryPolicy} on every
 * {@link #execute(RetryCallback)} call.
 * <p>
 * By default, each operation is attempted a maximum of three times with no back off in
 * between. A new instance can be fluently configured via {@link #builder}, e.g:
 * <pre> {@code
 * RetryTemplate.builder()
 *                 .maxAttempts(10)
 *                 .fixedBackoff(1000)
 *                 .build();
 * }</pre> See {@link RetryTemplateBuilder} for more examples and details.
 * <p>
 * This class is thread-safe and suitable for concurrent access when executing operations
 * and when performing configuration changes. A configuration change only affects
 * executions started afterwards.
 *
 * 重试模板
 */
public class RetryTemplate implements RetryOperations {

	protected final Log logger = LogFactory.getLog(getClass());

	/**
	 * 重试机制工厂，默认是固定重试次数机制
	 */
	private volatile Supplier<? extends RetryPolicy> retryPolicyFactory = SimpleRetryPolicy::new;

	private volatile ErrorHook errorHook;

	private volatile String name;

	/**
	 * Main entry point to configure RetryTemplate using fluent API. See
	 * {@link RetryTemplateBuilder} for usage examples and details.
	 * @return a new instance of RetryTemplateBuilder with preset default behaviour, that
	 * can be overwritten during manual configuration
	 */
	public static RetryTemplateBuilder builder() {
		return new RetryTemplateBuilder();
	}

	/**
	 * Creates a new default instance. The properties of default instance are described in
	 * {@link RetryTemplateBuilder} documentation.
	 * @return a new instance of RetryTemplate with default behaviour
	 */
	public static RetryTemplate defaultInstance() {
		return new RetryTemplateBuilder().build();
	}

	/**
	 * Setter for the factory of {@link RetryPolicy} instances. The factory must return a
	 * new instance on every call.
	 * @param retryPolicyFactory the factory
	 */
	public void setRetryPolicyFactory(Supplier<? extends RetryPolicy> retryPolicyFactory) {
		Assert.notNull(retryPolicyFactory, "RetryPolicy factory must not be null");
		this.retryPolicyFactory = retryPolicyFactory;
	}

	/**
	 * @param errorHook the hook notified of every failed attempt, or {@code null} for
	 * none
	 */
	public void setErrorHook(ErrorHook errorHook) {
		this.errorHook = errorHook;
	}

	/**
	 * @param name label of the executions in log messages, or {@code null} for none
	 */
	public void setName(String name) {
		this.name = name;
	}

	/**
	 * Keep executing the callback until it either succeeds or the policy dictates that we
	 * stop, in which case an {@link ExhaustedRetryException} wrapping the most recent
	 * exception thrown by the callback is thrown.
	 *
	 * @see RetryOperations#execute(RetryCallback)
	 * @param retryCallback the {@link RetryCallback}
	 */
	@Override
	public final <T> T execute(RetryCallback<T> retryCallback) throws ExhaustedRetryException {
		RetryPolicy retryPolicy = this.retryPolicyFactory.get();
		Assert.state(retryPolicy != null, "RetryPolicy factory returned null");
		if (this.logger.isTraceEnabled()) {
			this.logger.trace("Executing with policy: " + retryPolicy);
		}

		List<RetryOption> options = new ArrayList<>(2);
		ErrorHook errorHook = this.errorHook;
		if (errorHook != null) {
			options.add(RetryOptions.errorHook(errorHook));
		}
		String name = this.name;
		if (name != null) {
			options.add(RetryOptions.name(name));
		}
		return RetryExecutor.execute(retryPolicy, retryCallback, options.toArray(new RetryOption[0]));
	}

}
