/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.examples;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.flogger.FluentLogger;
import java.io.PrintStream;
import java.time.Duration;
import java.util.Map;
import net.goui.smsverify.service.PollConfig;

/**
 * Lists the poll presets and checks a custom timeout and poll interval against the limits for
 * real backends.
 *
 * <pre>{@code
 * PollConfigTool --timeout_ms 90000 --poll_interval_ms 2000
 * }</pre>
 */
public final class PollConfigTool {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final class Flags {
    @Parameter(names = "--timeout_ms", description = "Timeout to check (optional)")
    private long timeoutMillis = 0;

    @Parameter(names = "--poll_interval_ms", description = "Poll interval to check (optional)")
    private long pollIntervalMillis = 0;

    @Parameter(names = "--log_level", description = "JDK log level name")
    private String logLevel = "INFO";
  }

  static Flags parseFlags(String... args) {
    Flags flags = new Flags();
    JCommander.newBuilder().addObject(flags).build().parse(args);
    return flags;
  }

  static int run(Flags flags, PrintStream out) {
    out.format("%-10s %-10s %s%n", "preset", "timeout", "interval");
    for (Map.Entry<String, PollConfig> e : PollPresets.PRESETS.entrySet()) {
      PollConfig config = e.getValue();
      out.format(
          "%-10s %-10s %s%s%n",
          e.getKey(),
          config.getTimeout(),
          config.getPollInterval(),
          config.equals(PollConfig.defaults()) ? " (default)" : "");
    }
    if (flags.timeoutMillis <= 0 && flags.pollIntervalMillis <= 0) {
      return 0;
    }
    PollConfig.Builder builder = PollConfig.defaults().toBuilder();
    if (flags.timeoutMillis > 0) {
      builder.setTimeout(Duration.ofMillis(flags.timeoutMillis));
    }
    if (flags.pollIntervalMillis > 0) {
      builder.setPollInterval(Duration.ofMillis(flags.pollIntervalMillis));
    }
    PollConfig candidate = builder.build();
    try {
      candidate.validate();
    } catch (IllegalArgumentException e) {
      logger.atFine().withCause(e).log("rejected poll config: %s", candidate);
      out.format("Invalid: %s%n", e.getMessage());
      return 1;
    }
    out.format("Valid: %s%n", candidate);
    return 0;
  }

  public static void main(String[] args) {
    Flags flags = parseFlags(args);
    LogLevels.setLogging(flags.logLevel);
    System.exit(run(flags, System.out));
  }

  private PollConfigTool() {}
}
