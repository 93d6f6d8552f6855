/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

/**
 * Classifies a failure by the two different ways it might be recovered from.
 *
 * <ol>
 *   <li><em>Task level</em> ({@link #isRetryable()}): re-issuing the same call for the same task
 *       may succeed. This is true for transient problems such as network failures, rate limiting
 *       or temporary backend unavailability.
 *   <li><em>Operation level</em> ({@link #shouldRetryOperation()}): abandoning the task and
 *       starting again with a freshly rented number may succeed. This can be true even when the
 *       task itself is beyond recovery, for example if the rented number was banned or the task
 *       expired on a backend which is otherwise healthy.
 * </ol>
 *
 * <p>Both methods must be implemented explicitly. Neither value is derived from the other, so a
 * newly added error kind cannot silently inherit the wrong policy.
 */
public interface RetryableError {
  /** Whether re-issuing the same operation for the same task may succeed. */
  boolean isRetryable();

  /** Whether abandoning the task and acquiring a new number may succeed. */
  boolean shouldRetryOperation();
}
