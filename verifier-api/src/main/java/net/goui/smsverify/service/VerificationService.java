/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.service;

import com.ibm.icu.util.Region;
import java.util.List;
import net.goui.smsverify.AcquisitionResult;
import net.goui.smsverify.TaskId;

/**
 * Rents numbers and waits for verification codes to arrive for them, independent of the backend
 * which provides the numbers. {@link ProviderVerificationService} is the standard implementation.
 *
 * <p>Every failure is a {@link VerificationException} carrying both retryability flags, so a
 * decorator of this interface can decide what to do next without knowing the backend. For example
 * a failure with {@link VerificationException#shouldRetryOperation()} (such as a timeout) can be
 * handled by abandoning the task and renting a fresh number.
 *
 * @param <S> the type used to select which service a number is rented for.
 */
public interface VerificationService<S> {
  /**
   * Rents a number in the given country.
   *
   * @throws VerificationException with reason {@code NO_DIAL_CODE_FOR_COUNTRY}, {@code
   *     DIAL_CODE_BLACKLISTED}, {@code PROVIDER_FAILURE}, {@code MALFORMED_NUMBER} or {@code
   *     CANCEL_FAILED}.
   */
  AcquisitionResult acquireNumber(Region country, S service) throws VerificationException;

  /**
   * Rents a number in the first of the given countries able to provide one.
   *
   * @throws VerificationException with reason {@code NO_AVAILABLE_DIAL_CODES} if no country is
   *     usable, or the last failure if every usable country failed.
   */
  AcquisitionResult acquireNumber(List<Region> candidates, S service)
      throws VerificationException;

  /** Waits for a code with no external cancellation (only the configured timeout applies). */
  ReceivedCode waitForCode(TaskId taskId) throws VerificationException;

  /**
   * Waits for a code until it arrives, the configured timeout elapses or the token is cancelled.
   * Any outcome other than a received code releases the rented number.
   *
   * @throws VerificationException with reason {@code CANCELLED}, {@code TIMED_OUT}, {@code
   *     PROVIDER_FAILURE} or {@code CANCEL_FAILED}.
   */
  ReceivedCode waitForCode(TaskId taskId, CancellationToken cancellation)
      throws VerificationException;

  /** Tells the backend that the code for the given task was used. */
  void finish(TaskId taskId) throws VerificationException;

  /** Releases the number rented for the given task. */
  void cancel(TaskId taskId) throws VerificationException;
}
