/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import com.google.common.collect.ImmutableList;
import com.ibm.icu.util.Region;
import java.util.Optional;

/**
 * The capabilities every number rental backend must provide. A backend adapter translates these
 * operations into the backend's own wire protocol and reports failures as {@link
 * ProviderException}s.
 *
 * <p>Implementations hold no per-call state and must be safe to share between threads, since
 * independent verifications may run concurrently against the same instance.
 *
 * @param <S> the backend's identifier for what is being verified (e.g. which app the SMS is
 *     expected from).
 */
public interface Provider<S> {
  /** Rents a number in the given country for receiving a code from the given service. */
  AcquiredNumber acquireNumber(Region country, S service) throws ProviderException;

  /**
   * Asks whether a code has arrived for the given task. An empty result is not an error; it means
   * the caller should ask again later.
   */
  Optional<VerificationCode> pollCode(TaskId taskId) throws ProviderException;

  /** Tells the backend the received code was used. Idempotent. */
  void finish(TaskId taskId) throws ProviderException;

  /**
   * Releases the rented number. Idempotent, and safe to call after any failure (including a failed
   * acquisition which may nevertheless have started a billable session).
   */
  void cancel(TaskId taskId) throws ProviderException;

  /**
   * Returns whether numbers with the given dial code may be used. This is a filtering policy (a
   * backend may refuse dial codes it knows work badly), so the default accepts every dial code.
   */
  default boolean isDialCodeSupported(DialCode dialCode) {
    return true;
  }

  default boolean supportsService(S service) {
    return true;
  }

  /** Returns the countries known to offer numbers for the service (empty if not known). */
  default ImmutableList<Region> availableCountries(S service) {
    return ImmutableList.of();
  }

  /** Returns the services this backend knows about (empty if not known). */
  default ImmutableList<S> supportedServices() {
    return ImmutableList.of();
  }
}
