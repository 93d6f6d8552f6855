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
import com.ibm.icu.util.Region;

/**
 * A successfully rented number, split into its dial code and national number. Callers keep this
 * from acquisition until the verification code has been received (or the rental abandoned).
 */
@AutoValue
public abstract class AcquisitionResult {
  public static AcquisitionResult of(
      TaskId taskId,
      DialCode dialCode,
      NationalNumber nationalNumber,
      FullNumber fullNumber,
      Region country) {
    checkArgument(
        country.getType() == Region.RegionType.TERRITORY, "not a country: %s", country);
    return new AutoValue_AcquisitionResult(
        taskId, dialCode, nationalNumber, fullNumber, country);
  }

  public abstract TaskId getTaskId();

  public abstract DialCode getDialCode();

  public abstract NationalNumber getNationalNumber();

  public abstract FullNumber getFullNumber();

  public abstract Region getCountry();
}
