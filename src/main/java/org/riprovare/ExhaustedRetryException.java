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
 * Thrown when the {@link RetryPolicy} declines a further attempt. The cause is the
 * failure of the last attempt, so callers can tell "retries exhausted" apart from other
 * failures with a plain {@code catch} and still reach the root cause.
 *
 * 重试次数耗尽
 */
@SuppressWarnings("serial")
public class ExhaustedRetryException extends RetryException {

	private final int attempts;

	public ExhaustedRetryException(int attempts, Throwable lastThrowable) {
		super("max retries exceeded: " + (lastThrowable != null ? lastThrowable.getMessage() : null),
				lastThrowable);
		this.attempts = attempts;
	}

	/**
	 * @return the number of times the operation was invoked
	 */
	public int getAttempts() {
		return this.attempts;
	}

}
