/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.examples;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import net.goui.smsverify.service.PollConfig;

/** Named poll presets, as accepted by the {@code --preset} flag. */
final class PollPresets {
  static final ImmutableMap<String, PollConfig> PRESETS =
      ImmutableMap.of(
          "fast", PollConfig.fast(),
          "balanced", PollConfig.balanced(),
          "patient", PollConfig.patient());

  static PollConfig forName(String name) {
    PollConfig config = PRESETS.get(name.toLowerCase(Locale.ROOT));
    checkArgument(
        config != null, "unknown preset '%s' (expected one of %s)", name, PRESETS.keySet());
    return config;
  }

  private PollPresets() {}
}
