/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import static net.goui.smsverify.InvalidNumberException.Reason.EMPTY;
import static net.goui.smsverify.InvalidNumberException.Reason.NON_DIGIT;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;

/**
 * The international calling code of a phone number (e.g. "44" for the UK), held as ASCII digits
 * without any leading {@code '+'}.
 */
@AutoValue
public abstract class DialCode implements Comparable<DialCode> {
  static final CharMatcher ASCII_DIGIT = CharMatcher.inRange('0', '9');

  /**
   * Parses a dial code, ignoring surrounding whitespace and a single leading {@code '+'}.
   *
   * @throws InvalidNumberException if nothing remains, or if the remainder is not all digits.
   */
  public static DialCode parse(String text) {
    String digits = text.trim();
    if (digits.startsWith("+")) {
      digits = digits.substring(1);
    }
    if (digits.isEmpty()) {
      throw new InvalidNumberException(EMPTY, text);
    }
    if (!ASCII_DIGIT.matchesAllOf(digits)) {
      throw new InvalidNumberException(NON_DIGIT, text);
    }
    return new AutoValue_DialCode(digits);
  }

  /** Returns the dial code digits (never prefixed by {@code '+'}). */
  public abstract String getDigits();

  /** Returns the dial code with a leading {@code '+'}, as it would appear in E.164 numbers. */
  public final String withPlusPrefix() {
    return "+" + getDigits();
  }

  @Override
  public int compareTo(DialCode other) {
    return getDigits().compareTo(other.getDigits());
  }

  @Override
  public final String toString() {
    return getDigits();
  }
}
