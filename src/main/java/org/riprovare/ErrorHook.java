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
 * Observer notified of every failed attempt, before the {@link RetryPolicy} is consulted.
 * Typical uses are logging and capturing metrics. A hook cannot influence the retry: an
 * exception thrown from {@link #onError(Throwable)} is logged and otherwise ignored.
 * Subclasses of {@link Error} are not caught and end the execution.
 *
 * 异常监听
 */
@FunctionalInterface
public interface ErrorHook {

	/**
	 * Called once per failed attempt.
	 * @param throwable the failure of the attempt
	 */
	void onError(Throwable throwable);

}
