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
 * Defines the basic set of operations implemented by a reusable retry front end, such as
 * {@link org.riprovare.support.RetryTemplate}.
 *
 */
public interface RetryOperations {

	/**
	 * Execute the supplied {@link RetryCallback} with the configured retry semantics.
	 * @param retryCallback the {@link RetryCallback}
	 * @param <T> the return value
	 * @return the value returned by the {@link RetryCallback} upon successful invocation
	 * @throws ExhaustedRetryException if the policy stopped before the callback
	 * succeeded; its cause is the last failure
	 */
	<T> T execute(RetryCallback<T> retryCallback) throws ExhaustedRetryException;

}
