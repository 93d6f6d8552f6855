/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;

/**
 * An immutable set of dial codes a backend adapter refuses to use. Adapters typically delegate
 * {@link Provider#isDialCodeSupported(DialCode)} to an instance of this class.
 */
public final class DialCodeBlacklist {
  private static final DialCodeBlacklist EMPTY = new DialCodeBlacklist(ImmutableSet.of());

  public static DialCodeBlacklist empty() {
    return EMPTY;
  }

  /** Returns a blacklist of the given dial codes, each parsed via {@link DialCode#parse}. */
  public static DialCodeBlacklist of(String... dialCodes) {
    return of(Arrays.stream(dialCodes).map(DialCode::parse).collect(toImmutableSet()));
  }

  public static DialCodeBlacklist of(Iterable<DialCode> dialCodes) {
    return new DialCodeBlacklist(ImmutableSet.copyOf(dialCodes));
  }

  private final ImmutableSet<DialCode> blocked;

  private DialCodeBlacklist(ImmutableSet<DialCode> blocked) {
    this.blocked = blocked;
  }

  public boolean allows(DialCode dialCode) {
    return !blocked.contains(dialCode);
  }

  /** Returns a new blacklist which additionally blocks the given dial code. */
  public DialCodeBlacklist with(DialCode dialCode) {
    return new DialCodeBlacklist(
        ImmutableSet.<DialCode>builder().addAll(blocked).add(dialCode).build());
  }

  /** Returns a new blacklist which no longer blocks the given dial code. */
  public DialCodeBlacklist without(DialCode dialCode) {
    return new DialCodeBlacklist(
        blocked.stream().filter(d -> !d.equals(dialCode)).collect(toImmutableSet()));
  }

  public ImmutableSet<DialCode> getBlocked() {
    return blocked;
  }

  @Override
  public String toString() {
    return "DialCodeBlacklist" + blocked;
  }
}
