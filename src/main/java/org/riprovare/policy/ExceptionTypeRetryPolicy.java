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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.riprovare.RetryPolicy;
import org.springframework.util.Assert;

/**
 * A {@link RetryPolicy} that only retries failures of given types and hands those to a
 * delegate policy, which decides on the attempt budget and the back off. Everything
 * else stops the retries at once.
 * <p>
 * Types are matched by walking up the class hierarchy of the failure, so the most
 * specific type wins: with {@code IOException} fatal and {@code SocketTimeoutException}
 * retryable, a socket timeout is retried while any other I/O error is not.
 *
 * 按异常类型判断的重试机制
 */
public class ExceptionTypeRetryPolicy implements RetryPolicy {

	private static final Log logger = LogFactory.getLog(ExceptionTypeRetryPolicy.class);

	private final RetryPolicy delegate;

	private final Set<Class<? extends Throwable>> retryableTypes;

	private final Set<Class<? extends Throwable>> fatalTypes;

	/**
	 * 是否检查异常链
	 */
	private boolean traverseCauses = false;

	public ExceptionTypeRetryPolicy(RetryPolicy delegate, Collection<Class<? extends Throwable>> retryableTypes) {
		this(delegate, retryableTypes, Collections.<Class<? extends Throwable>>emptySet());
	}

	/**
	 * @param delegate the policy applied to retryable failures
	 * @param retryableTypes failure types worth another attempt, at least one
	 * @param fatalTypes failure types that must never be retried
	 */
	public ExceptionTypeRetryPolicy(RetryPolicy delegate, Collection<Class<? extends Throwable>> retryableTypes,
			Collection<Class<? extends Throwable>> fatalTypes) {
		Assert.notNull(delegate, "Delegate policy must not be null");
		Assert.notEmpty(retryableTypes, "At least one retryable type is required");
		Assert.noNullElements(retryableTypes, "Retryable types must not contain null elements");
		Assert.notNull(fatalTypes, "Fatal types must not be null");
		Assert.noNullElements(fatalTypes, "Fatal types must not contain null elements");
		this.delegate = delegate;
		this.retryableTypes = new LinkedHashSet<>(retryableTypes);
		this.fatalTypes = new LinkedHashSet<>(fatalTypes);
	}

	/**
	 * Whether an unmatched failure should be classified by its causes, nearest first.
	 * Defaults to false.
	 * @param traverseCauses true to inspect the cause chain
	 */
	public void setTraverseCauses(boolean traverseCauses) {
		this.traverseCauses = traverseCauses;
	}

	@Override
	public boolean canRetry(Throwable lastThrowable) {
		if (!isRetryable(lastThrowable)) {
			if (logger.isDebugEnabled()) {
				logger.debug("Not retrying failure of non retryable type: " + lastThrowable);
			}
			return false;
		}
		return this.delegate.canRetry(lastThrowable);
	}

	private boolean isRetryable(Throwable throwable) {
		Throwable current = throwable;
		while (current != null) {
			Boolean classified = classify(current.getClass());
			if (classified != null) {
				return classified;
			}
			if (!this.traverseCauses) {
				return false;
			}
			current = current.getCause();
		}
		return false;
	}

	private Boolean classify(Class<?> type) {
		for (Class<?> candidate = type; candidate != null; candidate = candidate.getSuperclass()) {
			if (this.fatalTypes.contains(candidate)) {
				return Boolean.FALSE;
			}
			if (this.retryableTypes.contains(candidate)) {
				return Boolean.TRUE;
			}
		}
		return null;
	}

}
