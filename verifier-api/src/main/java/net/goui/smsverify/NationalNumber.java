/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import static net.goui.smsverify.DialCode.ASCII_DIGIT;
import static net.goui.smsverify.InvalidNumberException.Reason.INVALID_LENGTH;
import static net.goui.smsverify.InvalidNumberException.Reason.LEADING_ZERO;
import static net.goui.smsverify.InvalidNumberException.Reason.MISSING_DIAL_CODE;
import static net.goui.smsverify.InvalidNumberException.Reason.NON_DIGIT;

import com.google.auto.value.AutoValue;

/** The national (local) part of a rented phone number, with the dial code removed. */
@AutoValue
public abstract class NationalNumber {
  static final int MIN_LENGTH = 4;
  static final int MAX_LENGTH = 14;

  /**
   * Parses a national number from a digit string (surrounding whitespace is ignored).
   *
   * @throws InvalidNumberException if the text is not 4 to 14 decimal digits, or if it starts
   *     with {@code '0'}.
   */
  public static NationalNumber parse(String text) {
    String digits = text.trim();
    if (!ASCII_DIGIT.matchesAllOf(digits)) {
      throw new InvalidNumberException(NON_DIGIT, text);
    }
    if (digits.length() < MIN_LENGTH || digits.length() > MAX_LENGTH) {
      throw new InvalidNumberException(INVALID_LENGTH, text);
    }
    if (digits.charAt(0) == '0') {
      throw new InvalidNumberException(LEADING_ZERO, text);
    }
    return new AutoValue_NationalNumber(digits);
  }

  /**
   * Derives the national number from a full number by removing the given dial code.
   *
   * <p>This is the inverse of concatenating a dial code and a national number, so for any valid
   * {@code n} and {@code d}, {@code fromFullNumber(FullNumber.of(d + n), d)} is equal to {@code n}.
   *
   * @throws InvalidNumberException with reason {@code MISSING_DIAL_CODE} if the full number does
   *     not start with the dial code, or with a syntactic reason if the remainder is not valid.
   */
  public static NationalNumber fromFullNumber(FullNumber fullNumber, DialCode dialCode) {
    String digits = fullNumber.withoutPlusPrefix();
    if (!digits.startsWith(dialCode.getDigits())) {
      throw new InvalidNumberException(MISSING_DIAL_CODE, fullNumber.getValue());
    }
    return parse(digits.substring(dialCode.getDigits().length()));
  }

  public abstract String getDigits();

  @Override
  public final String toString() {
    return getDigits();
  }
}
