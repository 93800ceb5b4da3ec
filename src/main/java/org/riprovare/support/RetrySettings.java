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
 * Per-execution settings populated by {@link RetryOption}s. The executor reads them once
 * all options are applied and does not change them afterwards.
 *
 * 重试执行配置
 */
public class RetrySettings {

	private ErrorHook errorHook;

	private String name;

	RetrySettings() {
	}

	/**
	 * @param errorHook the hook notified of every failed attempt
	 */
	public void setErrorHook(ErrorHook errorHook) {
		Assert.notNull(errorHook, "ErrorHook must not be null");
		this.errorHook = errorHook;
	}

	/**
	 * @param name label of the execution in log messages
	 */
	public void setName(String name) {
		Assert.hasText(name, "Name must not be empty");
		this.name = name;
	}

	/**
	 * @return the hook, or {@code null} if none was configured
	 */
	public ErrorHook getErrorHook() {
		return this.errorHook;
	}

	/**
	 * @return the label, or {@code null} if none was configured
	 */
	public String getName() {
		return this.name;
	}

}
