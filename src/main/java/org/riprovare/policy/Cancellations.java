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

import java.util.concurrent.CancellationException;

/**
 * Recognises failures that mean the caller gave up on the operation. Retrying such a
 * failure is never correct, whatever budget is left.
 *
 * 取消判断
 */
public final class Cancellations {

	private Cancellations() {
	}

	/**
	 * A failure is a cancellation if it, or any throwable in its cause chain, is a
	 * {@link CancellationException} or an {@link InterruptedException}.
	 * @param throwable the failure to inspect, may be {@code null}
	 * @return true if the failure signals cancellation
	 */
	public static boolean isCancellation(Throwable throwable) {
		Throwable current = throwable;
		int depth = 0;
		// 防止循环引用的异常链导致死循环
		while (current != null && depth++ < 32) {
			if (current instanceof CancellationException || current instanceof InterruptedException) {
				return true;
			}
			current = current.getCause();
		}
		return false;
	}

}
