/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * A rented phone number including its dial code, exactly as returned by a backend. Some backends
 * return numbers with a leading {@code '+'} and some do not; both forms are kept as given and the
 * difference only matters for presentation.
 */
@AutoValue
public abstract class FullNumber {
  public static FullNumber of(String number) {
    checkArgument(!number.trim().isEmpty(), "full number must not be empty");
    return new AutoValue_FullNumber(number);
  }

  /** The number as returned by the backend. */
  public abstract String getValue();

  public final String withPlusPrefix() {
    return "+" + withoutPlusPrefix();
  }

  public final String withoutPlusPrefix() {
    String trimmed = getValue().trim();
    return trimmed.startsWith("+") ? trimmed.substring(1) : trimmed;
  }

  @Override
  public final String toString() {
    return getValue();
  }
}
