/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.service;

import static com.google.common.base.Preconditions.checkState;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * A thread-safe, one-shot signal used to stop waiting for a verification code. Any thread may call
 * {@link #cancel()}; a waiting thread notices at its next check, or immediately if it is between
 * polls.
 */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken(false);

  /** Returns a new token which has not been cancelled. */
  public static CancellationToken create() {
    return new CancellationToken(true);
  }

  /** Returns a token which is never cancelled. */
  public static CancellationToken none() {
    return NONE;
  }

  private final CountDownLatch latch = new CountDownLatch(1);
  private final boolean cancellable;

  private CancellationToken(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /** Raises the signal. Calling this more than once has no further effect. */
  public void cancel() {
    checkState(cancellable, "cannot cancel the shared non-cancellable token");
    latch.countDown();
  }

  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  /**
   * Waits for up to the given duration, returning early if this token is cancelled.
   *
   * @return whether the token was cancelled.
   */
  @CanIgnoreReturnValue
  public boolean await(Duration duration) throws InterruptedException {
    return latch.await(duration.toNanos(), NANOSECONDS);
  }

  @Override
  public String toString() {
    return cancellable
        ? "CancellationToken{cancelled=" + isCancelled() + "}"
        : "CancellationToken{none}";
  }
}
