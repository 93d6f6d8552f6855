/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import com.google.common.collect.ImmutableSet;
import com.ibm.icu.util.Region;
import java.util.Optional;

/**
 * Read-only mapping from countries to their international dial codes. Instances are constructed
 * explicitly (typically once at startup) and passed to the code which needs them.
 */
public interface DialCodeLookup {
  /** Returns the dial code for the given country, or empty if it is not known. */
  Optional<DialCode> dialCodeFor(Region country);

  /** Returns all countries for which a dial code is known. */
  ImmutableSet<Region> supportedCountries();
}
