/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thrown when a dial code or national number cannot be constructed from the given text. The
 * {@link Reason} distinguishes syntactic problems from a number which does not start with the
 * expected dial code.
 */
public final class InvalidNumberException extends IllegalArgumentException {
  /** Why a number or dial code was rejected. */
  public enum Reason {
    EMPTY("must not be empty"),
    NON_DIGIT("must contain only decimal digits"),
    INVALID_LENGTH(
        "must have between "
            + NationalNumber.MIN_LENGTH
            + " and "
            + NationalNumber.MAX_LENGTH
            + " digits"),
    LEADING_ZERO("must not start with 0"),
    MISSING_DIAL_CODE("does not start with the expected dial code");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

  private final Reason reason;
  private final String input;

  InvalidNumberException(Reason reason, String input) {
    super(String.format("invalid value '%s': %s", input, reason.getDescription()));
    this.reason = checkNotNull(reason);
    this.input = input;
  }

  public Reason getReason() {
    return reason;
  }

  /** Returns the rejected text, as it was given. */
  public String getInput() {
    return input;
  }
}
