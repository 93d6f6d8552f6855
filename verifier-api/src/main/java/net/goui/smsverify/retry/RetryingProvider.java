/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.retry;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.ibm.icu.util.Region;
import java.time.Duration;
import java.util.Optional;
import net.goui.smsverify.AcquiredNumber;
import net.goui.smsverify.DialCode;
import net.goui.smsverify.Provider;
import net.goui.smsverify.ProviderException;
import net.goui.smsverify.TaskId;
import net.goui.smsverify.VerificationCode;

/**
 * A {@link Provider} which re-issues failed {@link #acquireNumber} and {@link #pollCode} calls
 * according to a {@link RetryPolicy}.
 *
 * <p>A call is retried only while the error it failed with is {@linkplain
 * ProviderException#isRetryable() retryable} and the policy's attempt budget is not used up.
 * Otherwise the error is rethrown exactly as the wrapped provider threw it. {@link #finish} and
 * {@link #cancel} are already best-effort and idempotent, so they (and the capability queries)
 * are passed straight through.
 *
 * <p>Retry state is local to each call, so a single instance can be shared by concurrent
 * verifications.
 */
public final class RetryingProvider<S> implements Provider<S> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Wraps the given provider using the {@linkplain RetryPolicy#defaults() default policy}. */
  public static <S> RetryingProvider<S> wrap(Provider<S> delegate) {
    return new RetryingProvider<>(
        delegate, RetryPolicy.defaults(), RetryObserver.NONE, Sleeper.SYSTEM);
  }

  public static <S> RetryingProvider<S> wrap(Provider<S> delegate, RetryPolicy policy) {
    return new RetryingProvider<>(delegate, policy, RetryObserver.NONE, Sleeper.SYSTEM);
  }

  private final Provider<S> delegate;
  private final RetryPolicy policy;
  private final RetryObserver observer;
  private final Sleeper sleeper;

  private RetryingProvider(
      Provider<S> delegate, RetryPolicy policy, RetryObserver observer, Sleeper sleeper) {
    this.delegate = checkNotNull(delegate);
    this.policy = checkNotNull(policy);
    this.observer = checkNotNull(observer);
    this.sleeper = checkNotNull(sleeper);
  }

  /** Returns a copy of this provider which notifies the given observer before each retry. */
  public RetryingProvider<S> withObserver(RetryObserver observer) {
    return new RetryingProvider<>(delegate, policy, observer, sleeper);
  }

  /** Returns a copy of this provider which waits between retries using the given sleeper. */
  public RetryingProvider<S> withSleeper(Sleeper sleeper) {
    return new RetryingProvider<>(delegate, policy, observer, sleeper);
  }

  public Provider<S> getDelegate() {
    return delegate;
  }

  public RetryPolicy getPolicy() {
    return policy;
  }

  @Override
  public AcquiredNumber acquireNumber(Region country, S service) throws ProviderException {
    return withRetry("acquireNumber", country, () -> delegate.acquireNumber(country, service));
  }

  @Override
  public Optional<VerificationCode> pollCode(TaskId taskId) throws ProviderException {
    return withRetry("pollCode", taskId, () -> delegate.pollCode(taskId));
  }

  @Override
  public void finish(TaskId taskId) throws ProviderException {
    delegate.finish(taskId);
  }

  @Override
  public void cancel(TaskId taskId) throws ProviderException {
    delegate.cancel(taskId);
  }

  @Override
  public boolean isDialCodeSupported(DialCode dialCode) {
    return delegate.isDialCodeSupported(dialCode);
  }

  @Override
  public boolean supportsService(S service) {
    return delegate.supportsService(service);
  }

  @Override
  public ImmutableList<Region> availableCountries(S service) {
    return delegate.availableCountries(service);
  }

  @Override
  public ImmutableList<S> supportedServices() {
    return delegate.supportedServices();
  }

  @FunctionalInterface
  private interface ProviderCall<T> {
    T call() throws ProviderException;
  }

  private <T> T withRetry(String operation, Object subject, ProviderCall<T> call)
      throws ProviderException {
    for (int attempt = 1; ; attempt++) {
      try {
        return call.call();
      } catch (ProviderException e) {
        if (!e.isRetryable() || attempt >= policy.getMaxAttempts()) {
          throw e;
        }
        Duration delay = policy.delayBeforeRetry(attempt - 1);
        logger.atFine().withCause(e).log(
            "%s(%s) failed on attempt %d of %d, retrying in %s",
            operation, subject, attempt, policy.getMaxAttempts(), delay);
        observer.onRetry(e, delay, attempt);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
          // The caller is giving up, so report the failure we already have.
          Thread.currentThread().interrupt();
          throw e;
        }
      }
    }
  }
}
