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

/**
 * A configuration step applied to the {@link RetrySettings} of a single execution, before
 * the first attempt. Options are applied in the order they are passed to
 * {@link RetryExecutor#execute}, so a later option overrides an earlier one.
 *
 * @see RetryOptions
 */
@FunctionalInterface
public interface RetryOption {

	void configure(RetrySettings settings);

}
