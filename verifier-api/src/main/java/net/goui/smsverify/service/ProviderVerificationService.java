/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.service;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Verify.verifyNotNull;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.ibm.icu.util.Region;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.goui.smsverify.AcquiredNumber;
import net.goui.smsverify.AcquisitionResult;
import net.goui.smsverify.DialCode;
import net.goui.smsverify.DialCodeLookup;
import net.goui.smsverify.InvalidNumberException;
import net.goui.smsverify.NationalNumber;
import net.goui.smsverify.Provider;
import net.goui.smsverify.ProviderException;
import net.goui.smsverify.TaskId;
import net.goui.smsverify.VerificationCode;
import net.goui.smsverify.service.VerificationException.Reason;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The standard {@link VerificationService}, which rents numbers from a {@link Provider} and polls
 * it for verification codes.
 *
 * <p>A typical verification is:
 *
 * <pre>{@code
 * AcquisitionResult number = service.acquireNumber(Region.getInstance("GB"), myService);
 * // ... trigger the SMS to number.getFullNumber() ...
 * ReceivedCode code = service.waitForCode(number.getTaskId());
 * // ... use the code ...
 * service.finish(number.getTaskId());
 * }</pre>
 *
 * <p>Whenever waiting for a code ends without a code (timeout, cancellation or a permanent
 * provider error), the rented number is released with exactly one {@link Provider#cancel} call.
 * If that call fails, the failure is reported with {@link Reason#CANCEL_FAILED} rather than the
 * triggering reason, so that numbers which may still be held by the backend are visible.
 *
 * <p>Instances are immutable and may be shared between threads, provided the provider can be.
 * Concurrent waits for the <em>same</em> task are not detected.
 */
public final class ProviderVerificationService<S> implements VerificationService<S> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Provider<S> provider;
  private final DialCodeLookup dialCodes;
  private final PollConfig config;
  private final Ticker ticker;

  public ProviderVerificationService(
      Provider<S> provider, DialCodeLookup dialCodes, PollConfig config) {
    this(provider, dialCodes, config, Ticker.systemTicker());
  }

  ProviderVerificationService(
      Provider<S> provider, DialCodeLookup dialCodes, PollConfig config, Ticker ticker) {
    this.provider = checkNotNull(provider);
    this.dialCodes = checkNotNull(dialCodes);
    this.config = checkNotNull(config);
    this.ticker = checkNotNull(ticker);
  }

  public Provider<S> getProvider() {
    return provider;
  }

  public PollConfig getConfig() {
    return config;
  }

  /**
   * Rents a number in the given country.
   *
   * <p>The country's dial code is resolved, and checked against the provider's dial code policy,
   * before anything is rented. If the rented number does not start with that dial code, the rental
   * is cancelled and the failure reported as {@link Reason#MALFORMED_NUMBER}.
   *
   * @throws VerificationException with reason {@code NO_DIAL_CODE_FOR_COUNTRY}, {@code
   *     DIAL_CODE_BLACKLISTED}, {@code PROVIDER_FAILURE}, {@code MALFORMED_NUMBER} or {@code
   *     CANCEL_FAILED}.
   */
  @Override
  public AcquisitionResult acquireNumber(Region country, S service) throws VerificationException {
    checkCountry(country);
    DialCode dialCode =
        dialCodes.dialCodeFor(country).orElseThrow(() -> VerificationException.noDialCode(country));
    if (!provider.isDialCodeSupported(dialCode)) {
      throw VerificationException.dialCodeBlacklisted(country, dialCode);
    }
    return acquire(country, dialCode, service);
  }

  /**
   * Rents a number in the first of the given countries able to provide one.
   *
   * <p>Countries without a known dial code, or whose dial code the provider does not support, are
   * skipped. The remaining countries are tried in order, moving on to the next country whenever
   * the provider failure suggests a fresh attempt might succeed (e.g. no numbers available). Any
   * other failure ends the search immediately.
   *
   * @throws VerificationException with reason {@code NO_AVAILABLE_DIAL_CODES} if no country is
   *     usable, or the last failure if every usable country failed.
   */
  @Override
  public AcquisitionResult acquireNumber(List<Region> candidates, S service)
      throws VerificationException {
    checkArgument(!candidates.isEmpty(), "no candidate countries given");
    Map<Region, DialCode> usable = new LinkedHashMap<>();
    for (Region country : candidates) {
      checkCountry(country);
      Optional<DialCode> dialCode = dialCodes.dialCodeFor(country);
      if (dialCode.isPresent() && provider.isDialCodeSupported(dialCode.get())) {
        usable.putIfAbsent(country, dialCode.get());
      } else {
        logger.atFine().log("skipping country %s (dial code: %s)", country, dialCode);
      }
    }
    if (usable.isEmpty()) {
      throw VerificationException.noAvailableDialCodes(ImmutableList.copyOf(candidates));
    }
    @Nullable VerificationException lastFailure = null;
    for (Map.Entry<Region, DialCode> e : usable.entrySet()) {
      try {
        return acquire(e.getKey(), e.getValue(), service);
      } catch (VerificationException failure) {
        if (failure.getReason() != Reason.PROVIDER_FAILURE || !failure.shouldRetryOperation()) {
          throw failure;
        }
        logger.atInfo().log(
            "cannot rent number in %s, trying next country: %s", e.getKey(), failure.getMessage());
        lastFailure = failure;
      }
    }
    throw verifyNotNull(lastFailure);
  }

  private AcquisitionResult acquire(Region country, DialCode dialCode, S service)
      throws VerificationException {
    AcquiredNumber acquired;
    try {
      acquired = provider.acquireNumber(country, service);
    } catch (ProviderException e) {
      logger.atWarning().log("failed to rent number in %s: %s", country, e);
      throw VerificationException.providerFailure(e, null);
    }
    TaskId taskId = acquired.getTaskId();
    NationalNumber nationalNumber;
    try {
      nationalNumber = NationalNumber.fromFullNumber(acquired.getFullNumber(), dialCode);
    } catch (InvalidNumberException e) {
      throw cancelAndReport(
          VerificationException.malformedNumber(taskId, acquired.getFullNumber(), dialCode, e));
    }
    logger.atInfo().log(
        "rented %s in %s (task %s)", acquired.getFullNumber().withPlusPrefix(), country, taskId);
    return AcquisitionResult.of(
        taskId, dialCode, nationalNumber, acquired.getFullNumber(), country);
  }

  /** Waits for a code with no external cancellation (only the configured timeout applies). */
  @Override
  public ReceivedCode waitForCode(TaskId taskId) throws VerificationException {
    return waitForCode(taskId, CancellationToken.none());
  }

  /**
   * Polls the provider until a code arrives for the given task, the configured timeout elapses, or
   * the token is cancelled.
   *
   * <p>Before every poll, cancellation is checked first and then the timeout, so a wait which is
   * already cancelled or expired never makes another request. Polls are strictly sequential.
   * Transient (retryable) poll errors are not reported; polling simply continues until the
   * timeout. Interrupting the waiting thread is treated as cancellation, and the thread's
   * interrupt status is preserved.
   *
   * <p>No cancel call is made when a code is received. The caller should {@link #finish} the task
   * once the code has been used.
   *
   * @throws VerificationException with reason {@code CANCELLED}, {@code TIMED_OUT}, {@code
   *     PROVIDER_FAILURE} (for non-retryable poll errors) or {@code CANCEL_FAILED}.
   */
  @Override
  public ReceivedCode waitForCode(TaskId taskId, CancellationToken cancellation)
      throws VerificationException {
    checkNotNull(taskId);
    checkNotNull(cancellation);
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    int pollCount = 0;
    while (true) {
      if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
        throw cancelAndReport(
            VerificationException.cancelled(taskId, stopwatch.elapsed(), pollCount));
      }
      Duration elapsed = stopwatch.elapsed();
      if (elapsed.compareTo(config.getTimeout()) >= 0) {
        throw cancelAndReport(
            VerificationException.timedOut(taskId, config.getTimeout(), elapsed, pollCount));
      }
      pollCount++;
      try {
        Optional<VerificationCode> code = provider.pollCode(taskId);
        if (code.isPresent()) {
          logger.atInfo().log(
              "received code for task %s after %s (%d poll(s))",
              taskId, stopwatch.elapsed(), pollCount);
          return ReceivedCode.of(taskId, code.get(), stopwatch.elapsed(), pollCount);
        }
      } catch (ProviderException e) {
        if (!e.isRetryable()) {
          throw cancelAndReport(
              VerificationException.providerFailure(e, taskId, stopwatch.elapsed(), pollCount));
        }
        logger.atFine().withCause(e).log("transient error polling task %s", taskId);
      }
      try {
        cancellation.await(config.getPollInterval());
      } catch (InterruptedException e) {
        // Seen as cancellation at the top of the loop.
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Tells the provider that the code for the given task was used. */
  @Override
  public void finish(TaskId taskId) throws VerificationException {
    try {
      provider.finish(taskId);
    } catch (ProviderException e) {
      throw VerificationException.providerFailure(e, taskId);
    }
  }

  /** Releases the number rented for the given task. */
  @Override
  public void cancel(TaskId taskId) throws VerificationException {
    try {
      provider.cancel(taskId);
    } catch (ProviderException e) {
      throw VerificationException.providerFailure(e, taskId);
    }
  }

  /**
   * Makes the single best-effort cancel call for a task which is being abandoned, returning the
   * failure the caller should throw.
   */
  private VerificationException cancelAndReport(VerificationException failure) {
    TaskId taskId = failure.getTaskId().orElseThrow();
    try {
      provider.cancel(taskId);
    } catch (ProviderException cancelError) {
      logger.atWarning().withCause(cancelError).log(
          "failed to cancel task %s after %s; the number may still be rented",
          taskId, failure.getReason());
      return VerificationException.cancelFailed(failure, cancelError);
    }
    logger.atWarning().log("cancelled task %s: %s", taskId, failure.getMessage());
    return failure;
  }

  private static void checkCountry(@Nullable Region country) {
    checkNotNull(country, "country");
    checkArgument(
        country.getType() == Region.RegionType.TERRITORY, "not a country: %s", country);
  }
}
