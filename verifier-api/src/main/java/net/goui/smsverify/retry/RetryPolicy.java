/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.retry;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;

/**
 * Exponential back-off policy for re-issuing a failed call.
 *
 * <p>The delay before the {@code n}th retry (counting from zero) is {@code minDelay * factor^n},
 * clamped to the range {@code [minDelay, maxDelay]}. Delays therefore never decrease as retries
 * accumulate and never exceed {@code maxDelay}.
 */
@AutoValue
public abstract class RetryPolicy {
  private static final RetryPolicy DEFAULT = builder().build();

  /** One second initial delay, doubling up to thirty seconds, with at most four attempts. */
  public static RetryPolicy defaults() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new AutoValue_RetryPolicy.Builder()
        .setMinDelay(Duration.ofSeconds(1))
        .setMaxDelay(Duration.ofSeconds(30))
        .setBackoffFactor(2.0)
        .setMaxAttempts(4);
  }

  public abstract Duration getMinDelay();

  public abstract Duration getMaxDelay();

  public abstract double getBackoffFactor();

  /** The maximum number of times a call is made, including the first. */
  public abstract int getMaxAttempts();

  public abstract Builder toBuilder();

  /** Returns the delay to wait before the given retry (where {@code 0} is the first retry). */
  public final Duration delayBeforeRetry(int retry) {
    checkArgument(retry >= 0, "retry index must not be negative: %s", retry);
    double scaled = getMinDelay().toNanos() * Math.pow(getBackoffFactor(), retry);
    if (Double.isInfinite(scaled) || scaled >= getMaxDelay().toNanos()) {
      return getMaxDelay();
    }
    Duration delay = Duration.ofNanos((long) scaled);
    return delay.compareTo(getMinDelay()) < 0 ? getMinDelay() : delay;
  }

  /** Builder for {@link RetryPolicy}, initialized with the default values. */
  @AutoValue.Builder
  public abstract static class Builder {
    @CanIgnoreReturnValue
    public abstract Builder setMinDelay(Duration minDelay);

    @CanIgnoreReturnValue
    public abstract Builder setMaxDelay(Duration maxDelay);

    @CanIgnoreReturnValue
    public abstract Builder setBackoffFactor(double factor);

    @CanIgnoreReturnValue
    public abstract Builder setMaxAttempts(int maxAttempts);

    abstract RetryPolicy autoBuild();

    public final RetryPolicy build() {
      RetryPolicy policy = autoBuild();
      checkArgument(
          !policy.getMinDelay().isNegative() && !policy.getMinDelay().isZero(),
          "minimum delay must be positive: %s",
          policy.getMinDelay());
      checkArgument(
          policy.getMaxDelay().compareTo(policy.getMinDelay()) >= 0,
          "maximum delay (%s) must not be less than minimum delay (%s)",
          policy.getMaxDelay(),
          policy.getMinDelay());
      checkArgument(
          policy.getBackoffFactor() >= 1.0,
          "back-off factor must be at least 1: %s",
          policy.getBackoffFactor());
      checkArgument(
          policy.getMaxAttempts() >= 1,
          "maximum attempts must be at least 1: %s",
          policy.getMaxAttempts());
      return policy;
    }
  }
}
