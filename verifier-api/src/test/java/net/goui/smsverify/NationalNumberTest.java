/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import static com.google.common.truth.Truth.assertThat;
import static net.goui.smsverify.InvalidNumberException.Reason.EMPTY;
import static net.goui.smsverify.InvalidNumberException.Reason.INVALID_LENGTH;
import static net.goui.smsverify.InvalidNumberException.Reason.LEADING_ZERO;
import static net.goui.smsverify.InvalidNumberException.Reason.MISSING_DIAL_CODE;
import static net.goui.smsverify.InvalidNumberException.Reason.NON_DIGIT;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NationalNumberTest {
  @Test
  public void testDialCodeParse() {
    assertThat(DialCode.parse("1").getDigits()).isEqualTo("1");
    assertThat(DialCode.parse("+380").getDigits()).isEqualTo("380");
    assertThat(DialCode.parse("  +7  ").getDigits()).isEqualTo("7");
    assertThat(DialCode.parse("+44").withPlusPrefix()).isEqualTo("+44");
    assertThat(DialCode.parse("44")).isEqualTo(DialCode.parse("+44"));
  }

  @Test
  public void testDialCodeErrors() {
    assertReason(EMPTY, () -> DialCode.parse(""));
    assertReason(EMPTY, () -> DialCode.parse("+"));
    assertReason(NON_DIGIT, () -> DialCode.parse("12a"));
    assertReason(NON_DIGIT, () -> DialCode.parse("++1"));
  }

  @Test
  public void testParse() {
    assertThat(NationalNumber.parse("1234").getDigits()).isEqualTo("1234");
    assertThat(NationalNumber.parse(" 12345678 ").getDigits()).isEqualTo("12345678");
    assertThat(NationalNumber.parse("12345678901234").getDigits()).isEqualTo("12345678901234");
  }

  @Test
  public void testParseErrors() {
    assertReason(INVALID_LENGTH, () -> NationalNumber.parse("123"));
    assertReason(INVALID_LENGTH, () -> NationalNumber.parse("123456789012345"));
    assertReason(INVALID_LENGTH, () -> NationalNumber.parse(""));
    assertReason(NON_DIGIT, () -> NationalNumber.parse("123a456"));
    assertReason(LEADING_ZERO, () -> NationalNumber.parse("01234567"));
  }

  @Test
  public void testFromFullNumber() {
    DialCode turkey = DialCode.parse("90");
    assertThat(NationalNumber.fromFullNumber(FullNumber.of("905488242474"), turkey))
        .isEqualTo(NationalNumber.parse("5488242474"));
    // Backends which return a leading '+' are handled identically.
    assertThat(NationalNumber.fromFullNumber(FullNumber.of("+905488242474"), turkey))
        .isEqualTo(NationalNumber.parse("5488242474"));
  }

  @Test
  public void testFromFullNumberErrors() {
    assertReason(
        MISSING_DIAL_CODE,
        () -> NationalNumber.fromFullNumber(FullNumber.of("905488242474"), DialCode.parse("380")));
    // Dial code matches, but what remains is not a valid national number.
    assertReason(
        LEADING_ZERO,
        () -> NationalNumber.fromFullNumber(FullNumber.of("4401234567"), DialCode.parse("44")));
  }

  @Test
  public void testFromFullNumberInvertsConcatenation() {
    ImmutableList<String> dialCodes = ImmutableList.of("1", "44", "380", "7", "998");
    ImmutableList<String> numbers =
        ImmutableList.of("1234", "5488242474", "12345678901234", "9000", "700000001");
    for (String d : dialCodes) {
      DialCode dialCode = DialCode.parse(d);
      for (String n : numbers) {
        NationalNumber number = NationalNumber.parse(n);
        assertThat(NationalNumber.fromFullNumber(FullNumber.of(d + n), dialCode))
            .isEqualTo(number);
      }
    }
  }

  @Test
  public void testFullNumberPresentation() {
    assertThat(FullNumber.of("380501234567").withPlusPrefix()).isEqualTo("+380501234567");
    assertThat(FullNumber.of("+380501234567").withPlusPrefix()).isEqualTo("+380501234567");
    assertThat(FullNumber.of("+380501234567").withoutPlusPrefix()).isEqualTo("380501234567");
    // Stored exactly as given.
    assertThat(FullNumber.of("+380501234567").toString()).isEqualTo("+380501234567");
  }

  private static void assertReason(InvalidNumberException.Reason reason, Runnable fn) {
    InvalidNumberException e = assertThrows(InvalidNumberException.class, fn::run);
    assertThat(e.getReason()).isEqualTo(reason);
  }
}
