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

package org.riprovare.backoff;

/**
 * Strategy interface for the timed suspension between two attempts. Abstracted away
 * from the policies so that tests can record back off periods instead of waiting.
 *
 * 休眠接口
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Pause for the specified period using whatever means available.
	 * @param backOffPeriod the back off period in milliseconds
	 * @throws InterruptedException if the current thread is interrupted while waiting,
	 * in which case the back off is abandoned
	 */
	void sleep(long backOffPeriod) throws InterruptedException;

}
