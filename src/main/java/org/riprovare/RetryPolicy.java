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

package org.riprovare;

/**
 * A {@link RetryPolicy} decides, after each failed attempt of a {@link RetryCallback},
 * whether the operation should be attempted again. Implementations are usually stateful
 * (remaining attempts, current back off period) and are bound to a single execution: an
 * instance must never be consulted by two executions at the same time.
 * <p>
 * A policy that wants a pause between attempts applies it itself, as a side effect of
 * {@link #canRetry(Throwable)}, before answering {@code true}. The executor never adds a
 * delay of its own.
 * <p>
 * Any lambda satisfying the contract is a valid policy, which makes it easy to base the
 * decision on the type of the failure, e.g. retry transient I/O errors but never
 * validation errors.
 *
 * 重试机制(策略)
 *
 */
@FunctionalInterface
public interface RetryPolicy {

	/**
	 * 判断是否可以重试
	 * @param lastThrowable the failure of the attempt that just completed, never
	 * {@code null} when called by the executor
	 * @return true if the operation should be attempted again, false to stop and surface
	 * an {@link ExhaustedRetryException}
	 */
	boolean canRetry(Throwable lastThrowable);

}
