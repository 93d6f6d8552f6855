/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.service;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;

/**
 * How long to wait for a verification code, and how often to ask for it.
 *
 * <p>Three presets cover the common cases:
 *
 * <ul>
 *   <li>{@link #fast()}: 60 second timeout, polling every second. Useful in development.
 *   <li>{@link #balanced()}: 120 second timeout, polling every 3 seconds. The default.
 *   <li>{@link #patient()}: 300 second timeout, polling every 5 seconds. For slow backends or
 *       unreliable networks.
 * </ul>
 *
 * <p>Construction only requires positive durations, so any configuration can be used (tests rely
 * on this to wait for milliseconds rather than seconds). Call {@link #validate()}, or build with
 * {@link Builder#buildValidated()}, to enforce the limits sensible for a real backend.
 */
@AutoValue
public abstract class PollConfig {
  /** The shortest timeout accepted by {@link #validate()}. */
  public static final Duration MIN_TIMEOUT = Duration.ofSeconds(10);

  /** The shortest poll interval accepted by {@link #validate()}. */
  public static final Duration MIN_POLL_INTERVAL = Duration.ofMillis(100);

  private static final PollConfig FAST = of(Duration.ofSeconds(60), Duration.ofSeconds(1));
  private static final PollConfig BALANCED = of(Duration.ofSeconds(120), Duration.ofSeconds(3));
  private static final PollConfig PATIENT = of(Duration.ofSeconds(300), Duration.ofSeconds(5));

  public static PollConfig fast() {
    return FAST;
  }

  public static PollConfig balanced() {
    return BALANCED;
  }

  public static PollConfig patient() {
    return PATIENT;
  }

  /** Returns the default configuration (the same as {@link #balanced()}). */
  public static PollConfig defaults() {
    return BALANCED;
  }

  public static PollConfig of(Duration timeout, Duration pollInterval) {
    return builder().setTimeout(timeout).setPollInterval(pollInterval).build();
  }

  /** Returns a builder initialized with the default configuration. */
  public static Builder builder() {
    return new AutoValue_PollConfig.Builder()
        .setTimeout(Duration.ofSeconds(120))
        .setPollInterval(Duration.ofSeconds(3));
  }

  /** The maximum time to wait for a code before giving up on the task. */
  public abstract Duration getTimeout();

  /** The time to wait between successive polls. */
  public abstract Duration getPollInterval();

  public abstract Builder toBuilder();

  public final PollConfig withTimeout(Duration timeout) {
    return toBuilder().setTimeout(timeout).build();
  }

  public final PollConfig withPollInterval(Duration pollInterval) {
    return toBuilder().setPollInterval(pollInterval).build();
  }

  /**
   * Checks this configuration against the limits for use with a real backend.
   *
   * @return this instance, for chaining.
   * @throws IllegalArgumentException if the timeout is shorter than {@link #MIN_TIMEOUT}, the poll
   *     interval is shorter than {@link #MIN_POLL_INTERVAL}, or the poll interval is not shorter
   *     than the timeout.
   */
  @CanIgnoreReturnValue
  public final PollConfig validate() {
    checkArgument(
        getTimeout().compareTo(MIN_TIMEOUT) >= 0,
        "timeout (%s) must be at least %s",
        getTimeout(),
        MIN_TIMEOUT);
    checkArgument(
        getPollInterval().compareTo(MIN_POLL_INTERVAL) >= 0,
        "poll interval (%s) must be at least %s",
        getPollInterval(),
        MIN_POLL_INTERVAL);
    checkArgument(
        getPollInterval().compareTo(getTimeout()) < 0,
        "poll interval (%s) must be less than timeout (%s)",
        getPollInterval(),
        getTimeout());
    return this;
  }

  /** Builder for {@link PollConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    @CanIgnoreReturnValue
    public abstract Builder setTimeout(Duration timeout);

    @CanIgnoreReturnValue
    public abstract Builder setPollInterval(Duration pollInterval);

    abstract PollConfig autoBuild();

    /** Builds a configuration, requiring only that both durations are positive. */
    public final PollConfig build() {
      PollConfig config = autoBuild();
      checkPositive(config.getTimeout(), "timeout");
      checkPositive(config.getPollInterval(), "poll interval");
      return config;
    }

    /** Builds a configuration and {@linkplain PollConfig#validate() validates} it. */
    public final PollConfig buildValidated() {
      return build().validate();
    }

    private static void checkPositive(Duration duration, String name) {
      checkArgument(
          !duration.isNegative() && !duration.isZero(), "%s must be positive: %s", name, duration);
    }
  }
}
