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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.riprovare.ErrorHook;
import org.riprovare.ExhaustedRetryException;
import org.riprovare.RetryCallback;
import org.riprovare.RetryPolicy;
import org.springframework.util.Assert;

/**
 * Runs a {@link RetryCallback} until it succeeds or the {@link RetryPolicy} gives up.
 * <p>
 * The callback is invoked at least once. On success its value is returned straight
 * away and the policy is not consulted. On failure the error hook, if any, is notified
 * and then the policy is asked whether to go on; the policy applies any pause itself.
 * When the policy says no, the last failure is wrapped in an
 * {@link ExhaustedRetryException}.
 * <pre class="code">
 * String body = RetryExecutor.execute(RetryPolicies.exponentialBackoff(5, 100),
 *         () -&gt; client.get(url),
 *         RetryOptions.errorHook(e -&gt; log.warn("GET failed", e)));
 * </pre>
 * A {@code null} policy, callback or option is a programming error and fails at once
 * with an {@link IllegalArgumentException}, before the callback is invoked. Subclasses
 * of {@link Error} thrown by the callback or the hook are not retried and propagate
 * unchanged.
 * <p>
 * All state lives on the stack of the calling thread, so concurrent executions are safe
 * as long as each one gets its own policy instance.
 *
 * 重试执行器
 */
public final class RetryExecutor {

	private static final Log logger = LogFactory.getLog(RetryExecutor.class);

	private static final String DEFAULT_NAME = "retryable operation";

	private RetryExecutor() {
	}

	/**
	 * Keep executing the callback until it either succeeds or the policy dictates that
	 * we stop.
	 * @param retryPolicy the policy for this execution only
	 * @param retryCallback the operation to run
	 * @param options settings applied in order before the first attempt
	 * @param <T> the type of the result
	 * @return the result of the first successful attempt
	 * @throws ExhaustedRetryException once the policy declines another attempt
	 */
	public static <T> T execute(RetryPolicy retryPolicy, RetryCallback<T> retryCallback, RetryOption... options)
			throws ExhaustedRetryException {
		Assert.notNull(retryPolicy, "Illegal use of API: RetryPolicy must not be null");
		Assert.notNull(retryCallback, "Illegal use of API: RetryCallback must not be null");

		RetrySettings settings = new RetrySettings();
		if (options != null) {
			for (RetryOption option : options) {
				Assert.notNull(option, "Illegal use of API: RetryOption must not be null");
				option.configure(settings);
			}
		}
		ErrorHook errorHook = settings.getErrorHook();
		String name = (settings.getName() != null ? settings.getName() : DEFAULT_NAME);

		int attempts = 0;
		while (true) {
			attempts++;
			Exception lastException;
			try {
				T result = retryCallback.doWithRetry();
				if (attempts > 1 && logger.isDebugEnabled()) {
					logger.debug("Succeeded " + name + " after " + attempts + " attempts");
				}
				return result;
			}
			catch (Exception ex) {
				lastException = ex;
			}

			if (lastException instanceof InterruptedException) {
				// 保留中断标记
				Thread.currentThread().interrupt();
			}
			if (logger.isDebugEnabled()) {
				logger.debug("Attempt #" + attempts + " of " + name + " failed: " + lastException);
			}

			// 先通知监听，再询问重试策略
			notifyErrorHook(errorHook, lastException, name);

			if (!retryPolicy.canRetry(lastException)) {
				if (logger.isDebugEnabled()) {
					logger.debug("Retry exhausted for " + name + " after " + attempts + " attempts");
				}
				throw new ExhaustedRetryException(attempts, lastException);
			}
		}
	}

	private static void notifyErrorHook(ErrorHook errorHook, Throwable throwable, String name) {
		if (errorHook == null) {
			return;
		}
		try {
			errorHook.onError(throwable);
		}
		catch (RuntimeException ex) {
			logger.warn("ErrorHook of " + name + " failed, continuing with retry", ex);
		}
	}

}
