/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.service;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.ibm.icu.util.Region;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import net.goui.smsverify.AcquiredNumber;
import net.goui.smsverify.AcquisitionResult;
import net.goui.smsverify.DialCode;
import net.goui.smsverify.DialCodeBlacklist;
import net.goui.smsverify.DialCodeLookup;
import net.goui.smsverify.FullNumber;
import net.goui.smsverify.NationalNumber;
import net.goui.smsverify.ProviderErrorKind;
import net.goui.smsverify.ProviderException;
import net.goui.smsverify.TaskId;
import net.goui.smsverify.VerificationCode;
import net.goui.smsverify.service.VerificationException.Reason;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProviderVerificationServiceTest {
  private static final Region UKRAINE = Region.getInstance("UA");
  private static final Region UK = Region.getInstance("GB");
  private static final Region FRANCE = Region.getInstance("FR");
  private static final Region GERMANY = Region.getInstance("DE");

  // Germany is deliberately missing.
  private static final DialCodeLookup DIAL_CODES =
      new DialCodeLookup() {
        private final ImmutableMap<Region, DialCode> codes =
            ImmutableMap.of(
                UKRAINE, DialCode.parse("380"),
                UK, DialCode.parse("44"),
                FRANCE, DialCode.parse("33"));

        @Override
        public Optional<DialCode> dialCodeFor(Region country) {
          return Optional.ofNullable(codes.get(country));
        }

        @Override
        public ImmutableSet<Region> supportedCountries() {
          return codes.keySet();
        }
      };

  private static final TaskId TASK = TaskId.of("42");
  private static final PollConfig QUICK =
      PollConfig.of(Duration.ofSeconds(60), Duration.ofMillis(10));

  private final StubProvider provider = new StubProvider();
  private final ManualTicker ticker = new ManualTicker();

  private VerificationService<String> service(PollConfig config) {
    return new ProviderVerificationService<>(provider, DIAL_CODES, config);
  }

  private VerificationService<String> serviceWithManualTime(PollConfig config) {
    return new ProviderVerificationService<>(provider, DIAL_CODES, config, ticker);
  }

  // ---- Waiting for codes ----

  @Test
  public void testCodeAfterSeveralPolls() throws Exception {
    provider.addNotYet(2).addCode("123456");

    ReceivedCode received = service(QUICK).waitForCode(TASK);

    assertThat(received.getCode()).isEqualTo(VerificationCode.of("123456"));
    assertThat(received.getPollCount()).isEqualTo(3);
    assertThat(received.getTaskId()).isEqualTo(TASK);
    assertThat(provider.cancelCalls.get()).isEqualTo(0);
  }

  @Test
  public void testCodeOnFirstPoll() throws Exception {
    provider.addCode("0000");
    ReceivedCode received = service(QUICK).waitForCode(TASK);
    assertThat(received.getPollCount()).isEqualTo(1);
    assertThat(received.getCode().getValue()).isEqualTo("0000");
  }

  @Test
  public void testTimeoutIsMeasuredByElapsedTime() {
    // Every poll "takes" 10ms, so the fifth poll reaches the 50ms timeout.
    provider.onPoll(() -> ticker.advance(Duration.ofMillis(10)));
    VerificationService<String> service =
        serviceWithManualTime(PollConfig.of(Duration.ofMillis(50), Duration.ofMillis(1)));

    VerificationException e =
        assertThrows(VerificationException.class, () -> service.waitForCode(TASK));

    assertThat(e.getReason()).isEqualTo(Reason.TIMED_OUT);
    assertThat(e.getPollCount().getAsInt()).isEqualTo(5);
    assertThat(e.getElapsed()).hasValue(Duration.ofMillis(50));
    assertThat(e.getTaskId()).hasValue(TASK);
    assertThat(provider.cancelCalls.get()).isEqualTo(1);
    // The same task cannot be retried, but a fresh number might work.
    assertThat(e.isRetryable()).isFalse();
    assertThat(e.shouldRetryOperation()).isTrue();
  }

  @Test
  public void testTimeoutInRealTime() {
    VerificationService<String> service =
        service(PollConfig.of(Duration.ofMillis(50), Duration.ofMillis(10)));

    VerificationException e =
        assertThrows(VerificationException.class, () -> service.waitForCode(TASK));

    assertThat(e.getReason()).isEqualTo(Reason.TIMED_OUT);
    assertThat(e.getElapsed().get()).isAtLeast(Duration.ofMillis(50));
    // Polls are at least 10ms apart and all start within the 50ms timeout. There is no lower
    // bound since a loaded machine may poll less often; testTimeoutIsMeasuredByElapsedTime pins
    // the exact count with a manual clock.
    assertThat(e.getPollCount().getAsInt()).isAtMost(6);
    assertThat(provider.cancelCalls.get()).isEqualTo(1);
  }

  @Test
  public void testExpiredBeforeFirstPoll() {
    Ticker expired =
        new Ticker() {
          private long reads = 0;

          @Override
          public long read() {
            // Starts at zero, then jumps well past the timeout.
            return reads++ == 0 ? 0 : Duration.ofSeconds(1).toNanos();
          }
        };
    VerificationService<String> expiring =
        new ProviderVerificationService<>(
            provider,
            DIAL_CODES,
            PollConfig.of(Duration.ofMillis(50), Duration.ofMillis(10)),
            expired);

    VerificationException e =
        assertThrows(VerificationException.class, () -> expiring.waitForCode(TASK));

    assertThat(e.getReason()).isEqualTo(Reason.TIMED_OUT);
    assertThat(e.getPollCount().getAsInt()).isEqualTo(0);
    assertThat(provider.pollCalls.get()).isEqualTo(0);
    assertThat(provider.cancelCalls.get()).isEqualTo(1);
  }

  @Test
  public void testCancelledBeforeFirstPoll() {
    CancellationToken token = CancellationToken.create();
    token.cancel();

    VerificationException e =
        assertThrows(VerificationException.class, () -> service(QUICK).waitForCode(TASK, token));

    assertThat(e.getReason()).isEqualTo(Reason.CANCELLED);
    assertThat(e.getPollCount().getAsInt()).isEqualTo(0);
    assertThat(provider.pollCalls.get()).isEqualTo(0);
    assertThat(provider.cancelCalls.get()).isEqualTo(1);
    assertThat(e.isRetryable()).isFalse();
    assertThat(e.shouldRetryOperation()).isFalse();
  }

  @Test
  public void testCancelWakesWaitingThread() throws Exception {
    // With a 10s poll interval, only a prompt wake-up lets this finish quickly.
    VerificationService<String> service =
        service(PollConfig.of(Duration.ofSeconds(60), Duration.ofSeconds(10)));
    CancellationToken token = CancellationToken.create();
    Thread canceller =
        new Thread(
            () -> {
              try {
                Thread.sleep(50);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              token.cancel();
            });
    Stopwatch stopwatch = Stopwatch.createStarted();
    canceller.start();

    VerificationException e =
        assertThrows(VerificationException.class, () -> service.waitForCode(TASK, token));
    canceller.join();

    assertThat(e.getReason()).isEqualTo(Reason.CANCELLED);
    assertThat(e.getPollCount().getAsInt()).isEqualTo(1);
    assertThat(stopwatch.elapsed()).isLessThan(Duration.ofSeconds(5));
    assertThat(provider.cancelCalls.get()).isEqualTo(1);
  }

  @Test
  public void testInterruptIsTreatedAsCancellation() {
    Thread.currentThread().interrupt();
    VerificationException e =
        assertThrows(VerificationException.class, () -> service(QUICK).waitForCode(TASK));

    assertThat(e.getReason()).isEqualTo(Reason.CANCELLED);
    assertThat(provider.pollCalls.get()).isEqualTo(0);
    assertThat(provider.cancelCalls.get()).isEqualTo(1);
    // Interrupt status is preserved (and cleared here for other tests).
    assertThat(Thread.interrupted()).isTrue();
  }

  @Test
  public void testCancelFailureDuringTimeout() {
    ProviderException cancelError = error(ProviderErrorKind.NETWORK_FAILURE);
    provider.failCancelWith(cancelError).onPoll(() -> ticker.advance(Duration.ofMillis(10)));
    VerificationService<String> service =
        serviceWithManualTime(PollConfig.of(Duration.ofMillis(50), Duration.ofMillis(1)));

    VerificationException e =
        assertThrows(VerificationException.class, () -> service.waitForCode(TASK));

    assertThat(e.getReason()).isEqualTo(Reason.CANCEL_FAILED);
    assertThat(e.getTriggerReason()).hasValue(Reason.TIMED_OUT);
    assertThat(e.getProviderError()).hasValue(cancelError);
    assertThat(e.getPollCount().getAsInt()).isEqualTo(5);
    assertThat(e.getSuppressed()).hasLength(1);
    assertThat(((VerificationException) e.getSuppressed()[0]).getReason())
        .isEqualTo(Reason.TIMED_OUT);
    // Exactly one cleanup attempt, even though it failed.
    assertThat(provider.cancelCalls.get()).isEqualTo(1);
  }

  @Test
  public void testCancelFailureDuringCancellation() {
    provider.failCancelWith(error(ProviderErrorKind.TASK_NOT_FOUND));
    CancellationToken token = CancellationToken.create();
    token.cancel();

    VerificationException e =
        assertThrows(VerificationException.class, () -> service(QUICK).waitForCode(TASK, token));

    assertThat(e.getReason()).isEqualTo(Reason.CANCEL_FAILED);
    assertThat(e.getTriggerReason()).hasValue(Reason.CANCELLED);
  }

  @Test
  public void testPermanentPollError() {
    ProviderException banned = error(ProviderErrorKind.TASK_BANNED_OR_EXPIRED);
    provider.addNotYet(1).addPollError(banned).addCode("never-reached");

    VerificationException e =
        assertThrows(VerificationException.class, () -> service(QUICK).waitForCode(TASK));

    assertThat(e.getReason()).isEqualTo(Reason.PROVIDER_FAILURE);
    assertThat(e.getProviderError()).hasValue(banned);
    assertThat(e.isRetryable()).isFalse();
    assertThat(e.shouldRetryOperation()).isTrue();
    assertThat(e.getPollCount().getAsInt()).isEqualTo(2);
    assertThat(provider.cancelCalls.get()).isEqualTo(1);
  }

  @Test
  public void testPermanentPollErrorWithFailedCancel() {
    provider
        .addPollError(error(ProviderErrorKind.INVALID_CREDENTIALS))
        .failCancelWith(error(ProviderErrorKind.INVALID_CREDENTIALS));

    VerificationException e =
        assertThrows(VerificationException.class, () -> service(QUICK).waitForCode(TASK));

    assertThat(e.getReason()).isEqualTo(Reason.CANCEL_FAILED);
    assertThat(e.getTriggerReason()).hasValue(Reason.PROVIDER_FAILURE);
  }

  @Test
  public void testTransientPollErrorsAreAbsorbed() throws Exception {
    provider
        .addPollError(error(ProviderErrorKind.NETWORK_FAILURE))
        .addPollError(error(ProviderErrorKind.BACKEND_UNAVAILABLE))
        .addCode("654321");

    ReceivedCode received = service(QUICK).waitForCode(TASK);

    assertThat(received.getCode().getValue()).isEqualTo("654321");
    assertThat(received.getPollCount()).isEqualTo(3);
    assertThat(provider.cancelCalls.get()).isEqualTo(0);
  }

  // ---- Acquiring numbers ----

  @Test
  public void testAcquireNumber() throws Exception {
    provider.addNumber(AcquiredNumber.of(TASK, FullNumber.of("380501234567")));

    AcquisitionResult result = service(QUICK).acquireNumber(UKRAINE, "ig");

    assertThat(result.getTaskId()).isEqualTo(TASK);
    assertThat(result.getDialCode()).isEqualTo(DialCode.parse("380"));
    assertThat(result.getNationalNumber()).isEqualTo(NationalNumber.parse("501234567"));
    assertThat(result.getFullNumber()).isEqualTo(FullNumber.of("380501234567"));
    assertThat(result.getCountry()).isEqualTo(UKRAINE);
  }

  @Test
  public void testAcquireNumberWithPlusPrefix() throws Exception {
    provider.addNumber(AcquiredNumber.of(TASK, FullNumber.of("+447471920002")));
    AcquisitionResult result = service(QUICK).acquireNumber(UK, "wa");
    assertThat(result.getNationalNumber()).isEqualTo(NationalNumber.parse("7471920002"));
    assertThat(result.getFullNumber().getValue()).isEqualTo("+447471920002");
  }

  @Test
  public void testNoDialCodeForCountry() {
    VerificationException e =
        assertThrows(
            VerificationException.class, () -> service(QUICK).acquireNumber(GERMANY, "ig"));
    assertThat(e.getReason()).isEqualTo(Reason.NO_DIAL_CODE_FOR_COUNTRY);
    assertThat(e.isRetryable()).isFalse();
    assertThat(e.shouldRetryOperation()).isFalse();
    assertThat(provider.acquiredCountries).isEmpty();
  }

  @Test
  public void testBlacklistedDialCode() {
    provider.blacklist(DialCodeBlacklist.of("33"));
    VerificationException e =
        assertThrows(
            VerificationException.class, () -> service(QUICK).acquireNumber(FRANCE, "ig"));
    assertThat(e.getReason()).isEqualTo(Reason.DIAL_CODE_BLACKLISTED);
    assertThat(e.isRetryable()).isFalse();
    // Nothing was rented.
    assertThat(provider.acquiredCountries).isEmpty();
  }

  @Test
  public void testProviderFailureKeepsFlags() {
    provider
        .addAcquireError(error(ProviderErrorKind.NO_NUMBERS_AVAILABLE))
        .addAcquireError(error(ProviderErrorKind.INVALID_CREDENTIALS));

    VerificationException noNumbers =
        assertThrows(
            VerificationException.class, () -> service(QUICK).acquireNumber(UKRAINE, "ig"));
    assertThat(noNumbers.getReason()).isEqualTo(Reason.PROVIDER_FAILURE);
    assertThat(noNumbers.isRetryable()).isTrue();
    assertThat(noNumbers.shouldRetryOperation()).isTrue();
    assertThat(noNumbers.getTaskId()).isEmpty();

    VerificationException badKey =
        assertThrows(
            VerificationException.class, () -> service(QUICK).acquireNumber(UKRAINE, "ig"));
    assertThat(badKey.isRetryable()).isFalse();
    assertThat(badKey.shouldRetryOperation()).isFalse();
    assertThat(provider.cancelCalls.get()).isEqualTo(0);
  }

  @Test
  public void testMalformedNumberIsCancelled() {
    // A UK number returned for a Ukrainian rental.
    provider.addNumber(AcquiredNumber.of(TASK, FullNumber.of("447471920002")));

    VerificationException e =
        assertThrows(
            VerificationException.class, () -> service(QUICK).acquireNumber(UKRAINE, "ig"));

    assertThat(e.getReason()).isEqualTo(Reason.MALFORMED_NUMBER);
    assertThat(e.getTaskId()).hasValue(TASK);
    assertThat(e.isRetryable()).isFalse();
    assertThat(provider.cancelCalls.get()).isEqualTo(1);
  }

  @Test
  public void testMalformedNumberWithFailedCancel() {
    provider
        .addNumber(AcquiredNumber.of(TASK, FullNumber.of("447471920002")))
        .failCancelWith(error(ProviderErrorKind.NETWORK_FAILURE));

    VerificationException e =
        assertThrows(
            VerificationException.class, () -> service(QUICK).acquireNumber(UKRAINE, "ig"));

    assertThat(e.getReason()).isEqualTo(Reason.CANCEL_FAILED);
    assertThat(e.getTriggerReason()).hasValue(Reason.MALFORMED_NUMBER);
  }

  @Test
  public void testAcquireFromCandidates() throws Exception {
    provider
        .blacklist(DialCodeBlacklist.of("33"))
        .addAcquireError(error(ProviderErrorKind.NO_NUMBERS_AVAILABLE))
        .addNumber(AcquiredNumber.of(TASK, FullNumber.of("447471920002")));

    AcquisitionResult result =
        service(QUICK).acquireNumber(ImmutableList.of(GERMANY, FRANCE, UKRAINE, UK), "ig");

    assertThat(result.getCountry()).isEqualTo(UK);
    // Germany (no dial code) and France (blacklisted) were never tried.
    assertThat(provider.acquiredCountries).containsExactly(UKRAINE, UK).inOrder();
  }

  @Test
  public void testAcquireFromCandidatesStopsOnPermanentFailure() {
    provider.addAcquireError(error(ProviderErrorKind.INVALID_CREDENTIALS));

    VerificationException e =
        assertThrows(
            VerificationException.class,
            () -> service(QUICK).acquireNumber(ImmutableList.of(UKRAINE, UK), "ig"));

    assertThat(e.getReason()).isEqualTo(Reason.PROVIDER_FAILURE);
    assertThat(provider.acquiredCountries).containsExactly(UKRAINE);
  }

  @Test
  public void testAcquireFromCandidatesAllFail() {
    ProviderException last = error(ProviderErrorKind.NO_NUMBERS_AVAILABLE);
    provider.addAcquireError(error(ProviderErrorKind.NO_NUMBERS_AVAILABLE)).addAcquireError(last);

    VerificationException e =
        assertThrows(
            VerificationException.class,
            () -> service(QUICK).acquireNumber(ImmutableList.of(UKRAINE, UK), "ig"));

    assertThat(e.getProviderError()).hasValue(last);
    assertThat(e.shouldRetryOperation()).isTrue();
  }

  @Test
  public void testNoAvailableDialCodes() {
    provider.blacklist(DialCodeBlacklist.of("33"));

    VerificationException e =
        assertThrows(
            VerificationException.class,
            () -> service(QUICK).acquireNumber(ImmutableList.of(GERMANY, FRANCE), "ig"));

    assertThat(e.getReason()).isEqualTo(Reason.NO_AVAILABLE_DIAL_CODES);
    assertThat(e.isRetryable()).isFalse();
    assertThat(provider.acquiredCountries).isEmpty();
  }

  @Test
  public void testFinishAndCancel() throws Exception {
    VerificationService<String> service = service(QUICK);
    service.finish(TASK);
    service.cancel(TASK);
    assertThat(provider.finishCalls.get()).isEqualTo(1);
    assertThat(provider.cancelCalls.get()).isEqualTo(1);

    provider.failCancelWith(error(ProviderErrorKind.TASK_NOT_FOUND));
    VerificationException e = assertThrows(VerificationException.class, () -> service.cancel(TASK));
    assertThat(e.getReason()).isEqualTo(Reason.PROVIDER_FAILURE);
    assertThat(e.getTaskId()).hasValue(TASK);
  }

  private static ProviderException error(ProviderErrorKind kind) {
    return new ProviderException(kind, kind.name());
  }

  private static final class ManualTicker extends Ticker {
    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
      return nanos.get();
    }

    void advance(Duration duration) {
      nanos.addAndGet(duration.toNanos());
    }
  }
}
