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

import org.riprovare.ErrorHook;
import org.springframework.util.Assert;

/**
 * Factory methods for the available {@link RetryOption}s.
 *
 */
public final class RetryOptions {

	private RetryOptions() {
	}

	/**
	 * Attach a hook called with the failure of every attempt, before the policy is
	 * consulted. This allows to capture errors for logging, metrics, etc.
	 * @param errorHook the hook, must not be {@code null}
	 * @return the option
	 * @throws IllegalArgumentException if the hook is {@code null}
	 */
	public static RetryOption errorHook(ErrorHook errorHook) {
		// 传入null只能是编程错误
		Assert.notNull(errorHook, "Illegal use of API: ErrorHook must not be null");
		return settings -> settings.setErrorHook(errorHook);
	}

	/**
	 * Label the execution in log messages.
	 * @param name the label, must not be empty
	 * @return the option
	 * @throws IllegalArgumentException if the name is empty
	 */
	public static RetryOption name(String name) {
		Assert.hasText(name, "Illegal use of API: name must not be empty");
		return settings -> settings.setName(name);
	}

}
