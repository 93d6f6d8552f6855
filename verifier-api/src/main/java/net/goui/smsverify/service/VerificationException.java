/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.service;

import static com.google.common.base.Preconditions.checkArgument;

import com.ibm.icu.util.Region;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import net.goui.smsverify.DialCode;
import net.goui.smsverify.FullNumber;
import net.goui.smsverify.InvalidNumberException;
import net.goui.smsverify.ProviderException;
import net.goui.smsverify.RetryableError;
import net.goui.smsverify.TaskId;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The terminal failure of a {@link VerificationService} operation.
 *
 * <p>Each failure has a {@link Reason} and both retryability flags, so a caller deciding whether
 * to run the whole verification flow again does not need to re-derive them. Failures of the
 * backend itself keep the flags of the original {@link ProviderException}.
 */
public final class VerificationException extends Exception implements RetryableError {
  /** What ended the operation. */
  public enum Reason {
    /** The provider reported an error (available via {@link #getProviderError()}). */
    PROVIDER_FAILURE,
    NO_DIAL_CODE_FOR_COUNTRY,
    /** The rented number did not start with the dial code of the requested country. */
    MALFORMED_NUMBER,
    TIMED_OUT,
    CANCELLED,
    /**
     * Releasing the rented number failed while handling another terminal condition (see {@link
     * #getTriggerReason()}). The number may still be held by the backend.
     */
    CANCEL_FAILED,
    DIAL_CODE_BLACKLISTED,
    NO_AVAILABLE_DIAL_CODES
  }

  private final Reason reason;
  private final boolean retryable;
  private final boolean retryOperation;
  @Nullable private final TaskId taskId;
  @Nullable private final Duration elapsed;
  private final int pollCount;
  @Nullable private final Reason triggerReason;

  private VerificationException(
      Reason reason,
      String message,
      @Nullable Throwable cause,
      boolean retryable,
      boolean retryOperation,
      @Nullable TaskId taskId,
      @Nullable Duration elapsed,
      int pollCount,
      @Nullable Reason triggerReason) {
    super(message, cause);
    this.reason = reason;
    this.retryable = retryable;
    this.retryOperation = retryOperation;
    this.taskId = taskId;
    this.elapsed = elapsed;
    this.pollCount = pollCount;
    this.triggerReason = triggerReason;
  }

  static VerificationException providerFailure(ProviderException error, @Nullable TaskId taskId) {
    return new VerificationException(
        Reason.PROVIDER_FAILURE,
        "provider error: " + error.getMessage(),
        error,
        error.isRetryable(),
        error.shouldRetryOperation(),
        taskId,
        null,
        -1,
        null);
  }

  /** A provider error which ended polling after the given number of polls. */
  static VerificationException providerFailure(
      ProviderException error, TaskId taskId, Duration elapsed, int pollCount) {
    return new VerificationException(
        Reason.PROVIDER_FAILURE,
        String.format(
            "provider error after %d poll(s) for task %s: %s",
            pollCount, taskId, error.getMessage()),
        error,
        error.isRetryable(),
        error.shouldRetryOperation(),
        taskId,
        elapsed,
        pollCount,
        null);
  }

  static VerificationException noDialCode(Region country) {
    return new VerificationException(
        Reason.NO_DIAL_CODE_FOR_COUNTRY,
        "no dial code known for country " + country,
        null,
        false,
        false,
        null,
        null,
        -1,
        null);
  }

  static VerificationException dialCodeBlacklisted(Region country, DialCode dialCode) {
    return new VerificationException(
        Reason.DIAL_CODE_BLACKLISTED,
        String.format(
            "dial code +%s (country %s) is not supported by the provider", dialCode, country),
        null,
        false,
        false,
        null,
        null,
        -1,
        null);
  }

  static VerificationException noAvailableDialCodes(List<Region> candidates) {
    return new VerificationException(
        Reason.NO_AVAILABLE_DIAL_CODES,
        "none of the candidate countries has a supported dial code: " + candidates,
        null,
        false,
        false,
        null,
        null,
        -1,
        null);
  }

  static VerificationException malformedNumber(
      TaskId taskId, FullNumber fullNumber, DialCode dialCode, InvalidNumberException cause) {
    return new VerificationException(
        Reason.MALFORMED_NUMBER,
        String.format(
            "cannot extract national number from '%s' with dial code +%s (task %s): %s",
            fullNumber, dialCode, taskId, cause.getReason().getDescription()),
        cause,
        false,
        false,
        taskId,
        null,
        -1,
        null);
  }

  static VerificationException timedOut(
      TaskId taskId, Duration timeout, Duration elapsed, int pollCount) {
    return new VerificationException(
        Reason.TIMED_OUT,
        String.format(
            "timed out waiting for code after %s (timeout %s, %d poll(s)) for task %s",
            elapsed, timeout, pollCount, taskId),
        null,
        false,
        true,
        taskId,
        elapsed,
        pollCount,
        null);
  }

  static VerificationException cancelled(TaskId taskId, Duration elapsed, int pollCount) {
    return new VerificationException(
        Reason.CANCELLED,
        String.format(
            "cancelled after %s (%d poll(s)) for task %s", elapsed, pollCount, taskId),
        null,
        false,
        false,
        taskId,
        elapsed,
        pollCount,
        null);
  }

  /**
   * Returns the failure to report when cancelling a task failed after {@code trigger} occurred.
   * The cancel error is the cause, and the triggering failure is attached as suppressed.
   */
  static VerificationException cancelFailed(
      VerificationException trigger, ProviderException cancelError) {
    checkArgument(trigger.taskId != null, "no task to cancel for: %s", trigger);
    VerificationException failure =
        new VerificationException(
            Reason.CANCEL_FAILED,
            String.format(
                "failed to cancel task %s after %s: %s",
                trigger.taskId, trigger.reason, cancelError.getMessage()),
            cancelError,
            false,
            false,
            trigger.taskId,
            trigger.elapsed,
            trigger.pollCount,
            trigger.reason);
    failure.addSuppressed(trigger);
    return failure;
  }

  public Reason getReason() {
    return reason;
  }

  @Override
  public boolean isRetryable() {
    return retryable;
  }

  @Override
  public boolean shouldRetryOperation() {
    return retryOperation;
  }

  /** Returns the task this failure relates to, if a number had been rented. */
  public Optional<TaskId> getTaskId() {
    return Optional.ofNullable(taskId);
  }

  /** Returns how long polling ran, for failures which ended a wait for a code. */
  public Optional<Duration> getElapsed() {
    return Optional.ofNullable(elapsed);
  }

  /** Returns the number of polls made, for failures which ended a wait for a code. */
  public OptionalInt getPollCount() {
    return pollCount >= 0 ? OptionalInt.of(pollCount) : OptionalInt.empty();
  }

  /** For {@link Reason#CANCEL_FAILED}, returns the reason the task was being cancelled. */
  public Optional<Reason> getTriggerReason() {
    return Optional.ofNullable(triggerReason);
  }

  /**
   * Returns the underlying provider error. For {@link Reason#PROVIDER_FAILURE} this is the error
   * which caused the failure, and for {@link Reason#CANCEL_FAILED} it is the cancel error.
   */
  public Optional<ProviderException> getProviderError() {
    Throwable cause = getCause();
    return cause instanceof ProviderException
        ? Optional.of((ProviderException) cause)
        : Optional.empty();
  }
}
