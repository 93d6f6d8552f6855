/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.dialcodes;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.ibm.icu.util.Region;
import com.ibm.icu.util.Region.RegionType;
import java.util.Optional;
import net.goui.smsverify.DialCode;
import net.goui.smsverify.DialCodeLookup;

/**
 * A {@link DialCodeLookup} backed by the metadata in libphonenumber. Countries are those ICU
 * territories for which libphonenumber knows a calling code.
 */
public final class LibPhoneNumberDialCodes implements DialCodeLookup {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Returns a lookup using the shared {@link PhoneNumberUtil} instance. */
  public static LibPhoneNumberDialCodes create() {
    return new LibPhoneNumberDialCodes(PhoneNumberUtil.getInstance());
  }

  private final PhoneNumberUtil phoneNumberUtil;
  private final ImmutableSet<Region> supportedCountries;

  LibPhoneNumberDialCodes(PhoneNumberUtil phoneNumberUtil) {
    this.phoneNumberUtil = checkNotNull(phoneNumberUtil);
    this.supportedCountries =
        Region.getAvailable(RegionType.TERRITORY).stream()
            .filter(r -> phoneNumberUtil.getCountryCodeForRegion(r.toString()) != 0)
            .sorted()
            .collect(toImmutableSet());
    logger.atFine().log("libphonenumber supports %d countries", supportedCountries.size());
  }

  @Override
  public Optional<DialCode> dialCodeFor(Region country) {
    // Returns 0 for unknown or non-geographic regions.
    int callingCode = phoneNumberUtil.getCountryCodeForRegion(country.toString());
    return callingCode != 0
        ? Optional.of(DialCode.parse(Integer.toString(callingCode)))
        : Optional.empty();
  }

  @Override
  public ImmutableSet<Region> supportedCountries() {
    return supportedCountries;
  }
}
