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

/**
 * Simple retry policy that allows a fixed number of attempts with no pause between them.
 * <pre class="code">
 * RetryExecutor.execute(new SimpleRetryPolicy(3), () -&gt; client.fetch(id));
 * </pre>
 *
 * 简单重试机制
 */
public class SimpleRetryPolicy extends AttemptCountingRetryPolicy {

	/**
	 * The default limit to the number of attempts for a new policy.
	 */
	public static final int DEFAULT_MAX_ATTEMPTS = 3;

	/**
	 * Create a {@link SimpleRetryPolicy} with the default number of attempts.
	 */
	public SimpleRetryPolicy() {
		this(DEFAULT_MAX_ATTEMPTS);
	}

	public SimpleRetryPolicy(int maxAttempts) {
		super(maxAttempts);
	}

	@Override
	protected boolean backOff() {
		return true;
	}

}
