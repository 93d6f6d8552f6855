/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.retry;

import java.time.Duration;
import net.goui.smsverify.ProviderException;

/**
 * Callback notified before each retry of a failed provider call, for logging or metrics. It is
 * invoked on the calling thread, before the back-off delay starts.
 */
@FunctionalInterface
public interface RetryObserver {
  RetryObserver NONE = (error, delay, attempt) -> {};

  /**
   * @param error the transient error which caused the retry.
   * @param delay how long the caller will wait before the next attempt.
   * @param attempt the number of the attempt which just failed, starting from 1.
   */
  void onRetry(ProviderException error, Duration delay, int attempt);
}
