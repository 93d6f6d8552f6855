/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.examples;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.ibm.icu.util.Region;
import com.ibm.icu.util.Region.RegionType;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import net.goui.smsverify.AcquisitionResult;
import net.goui.smsverify.DialCodeBlacklist;
import net.goui.smsverify.DialCodeLookup;
import net.goui.smsverify.ProviderErrorKind;
import net.goui.smsverify.dialcodes.DialCodeTable;
import net.goui.smsverify.dialcodes.LibPhoneNumberDialCodes;
import net.goui.smsverify.retry.RetryPolicy;
import net.goui.smsverify.retry.RetryingProvider;
import net.goui.smsverify.service.CancellationToken;
import net.goui.smsverify.service.PollConfig;
import net.goui.smsverify.service.ProviderVerificationService;
import net.goui.smsverify.service.ReceivedCode;
import net.goui.smsverify.service.VerificationException;
import net.goui.smsverify.service.VerificationService;
import net.goui.smsverify.testing.FakeProvider;

/**
 * Runs a complete verification (rent a number, wait for the code, release the number) against an
 * in-memory provider whose flakiness is controlled by flags. Retries and their back-off are
 * printed as they happen.
 *
 * <pre>{@code
 * VerificationDemo --country FR --country UA --blacklist 33 --flaky_acquires 2 --log_level FINE
 * VerificationDemo --never_deliver --cancel_after_ms 2500
 * }</pre>
 */
public final class VerificationDemo {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final class Flags {
    @Parameter(
        names = "--country",
        description = "Candidate country (ISO 3166 alpha-2), repeatable; tried in order")
    private List<String> countries = new ArrayList<>();

    @Parameter(names = "--service", description = "Service the number is rented for")
    private String service = "ig";

    @Parameter(names = "--preset", description = "Poll preset: fast, balanced or patient")
    private String preset = "fast";

    @Parameter(names = "--timeout_ms", description = "Overrides the preset timeout (optional)")
    private long timeoutMillis = 0;

    @Parameter(
        names = "--poll_interval_ms",
        description = "Overrides the preset poll interval (optional)")
    private long pollIntervalMillis = 0;

    @Parameter(names = "--unchecked", description = "Skip poll configuration limits")
    private boolean unchecked = false;

    @Parameter(names = "--dial_codes", description = "Dial code source: table or libphonenumber")
    private String dialCodeSource = "table";

    @Parameter(names = "--blacklist", description = "Dial code the provider refuses, repeatable")
    private List<String> blacklist = new ArrayList<>();

    @Parameter(names = "--flaky_acquires", description = "Transient failures before renting")
    private int flakyAcquires = 0;

    @Parameter(names = "--flaky_polls", description = "Transient failures while polling")
    private int flakyPolls = 0;

    @Parameter(names = "--empty_polls", description = "Polls before the code arrives")
    private int emptyPolls = 2;

    @Parameter(names = "--never_deliver", description = "Never deliver a code")
    private boolean neverDeliver = false;

    @Parameter(names = "--cancel_after_ms", description = "Cancel the wait after this long")
    private long cancelAfterMillis = 0;

    @Parameter(names = "--min_backoff_ms", description = "Initial retry back-off")
    private long minBackoffMillis = 1000;

    @Parameter(names = "--log_level", description = "JDK log level name")
    private String logLevel = "INFO";
  }

  static Flags parseFlags(String... args) {
    Flags flags = new Flags();
    JCommander.newBuilder().addObject(flags).build().parse(args);
    return flags;
  }

  /** Runs the demo, writing a report to {@code out}, and returns the process exit code. */
  static int run(Flags flags, PrintStream out) throws IOException {
    ImmutableList<Region> countries;
    PollConfig config;
    DialCodeBlacklist blacklist;
    DialCodeLookup dialCodes;
    RetryPolicy policy;
    try {
      countries = parseCountries(flags.countries);
      config = pollConfig(flags);
      blacklist = DialCodeBlacklist.of(flags.blacklist.toArray(new String[0]));
      dialCodes = loadDialCodes(flags.dialCodeSource);
      policy =
          RetryPolicy.defaults().toBuilder()
              .setMinDelay(Duration.ofMillis(flags.minBackoffMillis))
              .build();
    } catch (IllegalArgumentException e) {
      out.format("Invalid flags: %s%n", e.getMessage());
      return 2;
    }

    FakeProvider<String> fake =
        FakeProvider.<String>create(dialCodes)
            .withBlacklist(blacklist)
            .failAcquire(repeat(ProviderErrorKind.RATE_LIMITED, flags.flakyAcquires))
            .failPolls(repeat(ProviderErrorKind.NETWORK_FAILURE, flags.flakyPolls));
    if (flags.neverDeliver) {
      fake.neverDeliverCodes();
    } else {
      fake.deliverCodeAfter(flags.emptyPolls, "123456");
    }
    RetryingProvider<String> provider =
        RetryingProvider.wrap(fake, policy)
            .withObserver(
                (error, delay, attempt) ->
                    out.format(
                        "Attempt %d failed (%s), retrying in %s%n",
                        attempt, error.getKind(), delay));
    VerificationService<String> service =
        new ProviderVerificationService<>(provider, dialCodes, config);

    out.format(
        "Poll config     : timeout=%s, interval=%s%n",
        config.getTimeout(), config.getPollInterval());
    CancellationToken cancellation = CancellationToken.create();
    ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    try {
      if (flags.cancelAfterMillis > 0) {
        scheduler.schedule(cancellation::cancel, flags.cancelAfterMillis, MILLISECONDS);
      }
      AcquisitionResult number = service.acquireNumber(countries, flags.service);
      out.format("Number          : %s%n", number.getFullNumber().withPlusPrefix());
      out.format("Country         : %s%n", number.getCountry());
      out.format("Dial code       : %s%n", number.getDialCode().withPlusPrefix());
      out.format("National number : %s%n", number.getNationalNumber());

      ReceivedCode code = service.waitForCode(number.getTaskId(), cancellation);
      service.finish(number.getTaskId());
      out.format("Code            : %s%n", code.getCode());
      out.format("Polls           : %d (%s)%n", code.getPollCount(), code.getElapsed());
      return 0;
    } catch (VerificationException e) {
      logger.atFine().withCause(e).log("verification failed");
      out.format("Failed          : %s (%s)%n", e.getReason(), e.getMessage());
      out.format("Retry same task : %s%n", e.isRetryable());
      out.format("Retry new number: %s%n", e.shouldRetryOperation());
      return 1;
    } finally {
      scheduler.shutdownNow();
    }
  }

  private static ImmutableList<Region> parseCountries(List<String> codes) {
    List<String> countries = codes.isEmpty() ? Collections.singletonList("UA") : codes;
    ImmutableList<Region> regions =
        countries.stream().map(Region::getInstance).collect(toImmutableList());
    for (Region region : regions) {
      checkArgument(region.getType() == RegionType.TERRITORY, "not a country: %s", region);
    }
    return regions;
  }

  private static PollConfig pollConfig(Flags flags) {
    PollConfig.Builder builder = PollPresets.forName(flags.preset).toBuilder();
    if (flags.timeoutMillis > 0) {
      builder.setTimeout(Duration.ofMillis(flags.timeoutMillis));
    }
    if (flags.pollIntervalMillis > 0) {
      builder.setPollInterval(Duration.ofMillis(flags.pollIntervalMillis));
    }
    return flags.unchecked ? builder.build() : builder.buildValidated();
  }

  private static DialCodeLookup loadDialCodes(String source) throws IOException {
    switch (source) {
      case "table":
        return DialCodeTable.loadDefault();
      case "libphonenumber":
        return LibPhoneNumberDialCodes.create();
      default:
        throw new IllegalArgumentException("unknown dial code source: " + source);
    }
  }

  private static ProviderErrorKind[] repeat(ProviderErrorKind kind, int count) {
    return Collections.nCopies(count, kind).toArray(new ProviderErrorKind[0]);
  }

  public static void main(String[] args) throws IOException {
    Flags flags = parseFlags(args);
    LogLevels.setLogging(flags.logLevel);
    System.exit(run(flags, System.out));
  }

  private VerificationDemo() {}
}
